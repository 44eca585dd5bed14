package com.calibration.splineengine.api.dto;

import com.calibration.splineengine.domain.model.SplineParameters;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SplineEvaluateRequest {

    @JsonProperty("params")
    private SplineParameters parameters;

    @JsonProperty("points")
    private double[] points;
}
