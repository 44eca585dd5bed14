package com.calibration.splineengine.api.dto;

import com.calibration.splineengine.domain.model.CalibrationArtifact;
import com.calibration.splineengine.domain.model.FitDiagnostics;
import com.calibration.splineengine.domain.model.SurfaceCell;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TwoFactorCalibrationResponse(
        @JsonProperty("artifact") CalibrationArtifact artifact,
        @JsonProperty("curve_a_fit") FitDiagnostics curveAFit,
        @JsonProperty("curve_b_fit") FitDiagnostics curveBFit,
        @JsonProperty("surface") List<SurfaceCell> surface) {
}
