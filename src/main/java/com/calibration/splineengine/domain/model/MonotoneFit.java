package com.calibration.splineengine.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MonotoneFit(@JsonProperty("params") SplineParameters parameters,
                          @JsonProperty("fit_info") FitDiagnostics diagnostics) {
}
