package com.calibration.splineengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CalibrationDiagnostics {

    @JsonProperty("rmse")
    private double rmse;

    @JsonProperty("r2")
    private double r2;

    @JsonProperty("curve_a_monotone")
    private boolean curveAMonotone;

    @JsonProperty("curve_b_monotone")
    private boolean curveBMonotone;

    @JsonProperty("converged")
    private boolean converged;

    @JsonProperty("n_iterations")
    private int iterations;

    @JsonProperty("anchor_a")
    private double anchorA;

    @JsonProperty("anchor_b")
    private double anchorB;

    @JsonProperty("curve_a_r2")
    private double curveAR2;

    @JsonProperty("curve_b_r2")
    private double curveBR2;

    @JsonProperty("curve_a_converged")
    private boolean curveAConverged;

    @JsonProperty("curve_b_converged")
    private boolean curveBConverged;

    @JsonProperty("global_intercept")
    private double globalIntercept;
}
