package com.calibration.splineengine.infra.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class FitMetricsRecorder {

    private final Timer splineFitTimer;
    private final Counter splineNonConverged;
    private final Counter splineNonMonotone;
    private final Timer calibrationTimer;
    private final Counter calibrationRuns;

    public FitMetricsRecorder(MeterRegistry meterRegistry) {
        this.splineFitTimer = Timer.builder("spline.fit.duration")
                .description("Monotone spline fit latency (all restarts)")
                .register(meterRegistry);
        this.splineNonConverged = Counter.builder("spline.fit.nonconverged")
                .description("Spline fits whose best restart did not converge")
                .register(meterRegistry);
        this.splineNonMonotone = Counter.builder("spline.fit.nonmonotone")
                .description("Spline fits failing the grid monotonicity check")
                .register(meterRegistry);
        this.calibrationTimer = Timer.builder("calibration.two_factor.duration")
                .description("Two-factor calibration latency")
                .register(meterRegistry);
        this.calibrationRuns = Counter.builder("calibration.two_factor.runs")
                .description("Completed two-factor calibrations")
                .register(meterRegistry);
    }

    public void recordSplineFit(long elapsedNanos, boolean converged, boolean monotone) {
        splineFitTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
        if (!converged) splineNonConverged.increment();
        if (!monotone) splineNonMonotone.increment();
    }

    public void recordCalibration(long elapsedNanos) {
        calibrationTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
        calibrationRuns.increment();
    }
}
