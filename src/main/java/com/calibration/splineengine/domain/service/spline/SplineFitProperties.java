package com.calibration.splineengine.domain.service.spline;

import com.calibration.splineengine.domain.service.optimizer.OptimizerSettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "spline.fit")
public class SplineFitProperties {

    private int restarts = 3;
    private double perturbationScale = 0.5;
    private long seed = 42L;
    private int maxIterations = 2000;
    private double functionTolerance = 1e-12;
    private double gradientTolerance = 1e-8;
    private int historySize = 10;
    private int monotonicityGridSize = 200;
    private double monotonicityTolerance = 1e-10;
    private int defaultDegree = 3;
    private double defaultSmoothnessPenalty = 0.001;

    public OptimizerSettings optimizerSettings() {
        return OptimizerSettings.builder()
                .maxIterations(maxIterations)
                .functionTolerance(functionTolerance)
                .gradientTolerance(gradientTolerance)
                .historySize(historySize)
                .build();
    }
}
