package com.calibration.splineengine.domain.service.optimizer;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class OptimizerSettings {

    @Builder.Default
    private final int maxIterations = 2000;

    @Builder.Default
    private final double functionTolerance = 1e-12;

    @Builder.Default
    private final double gradientTolerance = 1e-8;

    @Builder.Default
    private final int historySize = 10;

    @Builder.Default
    private final int maxLineSearchSteps = 40;
}
