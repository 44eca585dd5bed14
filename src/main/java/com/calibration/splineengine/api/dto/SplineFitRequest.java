package com.calibration.splineengine.api.dto;

import com.calibration.splineengine.domain.model.AnchorPoint;
import com.calibration.splineengine.domain.service.spline.MonotoneFitRequest;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SplineFitRequest {

    @JsonProperty("x")
    private double[] x;

    @JsonProperty("y")
    private double[] y;

    @JsonProperty("weights")
    private double[] weights;

    @JsonProperty("n_basis")
    private Integer numBasis;

    @JsonProperty("degree")
    private Integer degree;

    @JsonProperty("smoothness_penalty")
    private Double smoothnessPenalty;

    @JsonProperty("anchor")
    private AnchorPoint anchor;

    @JsonProperty("x_min")
    private Double domainMin;

    @JsonProperty("x_max")
    private Double domainMax;

    @JsonProperty("seed")
    private Long seed;

    public MonotoneFitRequest toFitRequest() {
        MonotoneFitRequest.MonotoneFitRequestBuilder builder = MonotoneFitRequest.builder()
                .x(x)
                .y(y)
                .weights(weights)
                .degree(degree)
                .smoothnessPenalty(smoothnessPenalty)
                .anchor(anchor)
                .domainMin(domainMin)
                .domainMax(domainMax)
                .seed(seed);
        if (numBasis != null) {
            builder.numBasis(numBasis);
        }
        return builder.build();
    }
}
