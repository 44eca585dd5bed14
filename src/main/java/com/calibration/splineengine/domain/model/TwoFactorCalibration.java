package com.calibration.splineengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class TwoFactorCalibration {

    private final SplineParameters curveA;
    private final SplineParameters curveB;
    private final double globalIntercept;
    private final CalibrationDiagnostics diagnostics;
    private final FitDiagnostics curveAFit;
    private final FitDiagnostics curveBFit;
    private final DiscreteEffects discreteA;
    private final DiscreteEffects discreteB;
    private final List<SurfaceCell> surface;
}
