package com.calibration.splineengine.domain.service.optimizer;

import lombok.Getter;

@Getter
public class OptimizationResult {

    private final double[] point;
    private final double value;
    private final int iterations;
    private final int evaluations;
    private final boolean converged;
    private final String message;

    public OptimizationResult(double[] point, double value, int iterations, int evaluations,
                              boolean converged, String message) {
        this.point = point.clone();
        this.value = value;
        this.iterations = iterations;
        this.evaluations = evaluations;
        this.converged = converged;
        this.message = message;
    }

    public double[] getPoint() {
        return point.clone();
    }
}
