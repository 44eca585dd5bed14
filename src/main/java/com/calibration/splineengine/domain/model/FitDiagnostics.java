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
public class FitDiagnostics {

    @JsonProperty("rmse")
    private double rmse;

    @JsonProperty("r2")
    private double r2;

    @JsonProperty("is_monotone")
    private boolean monotone;

    @JsonProperty("converged")
    private boolean converged;

    @JsonProperty("n_iterations")
    private int iterations;

    @JsonProperty("message")
    private String message;
}
