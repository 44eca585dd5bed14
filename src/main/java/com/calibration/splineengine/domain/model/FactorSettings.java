package com.calibration.splineengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 한 요인(factor) 곡선의 보정 설정. domainMin/domainMax 가 비어 있으면 관측 레벨의 범위를 쓴다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FactorSettings {

    @JsonProperty("anchor")
    private Double anchor;

    @Builder.Default
    @JsonProperty("n_basis")
    private int numBasis = 6;

    @Builder.Default
    @JsonProperty("degree")
    private int degree = 3;

    @Builder.Default
    @JsonProperty("smoothness_penalty")
    private double smoothnessPenalty = 0.001;

    @JsonProperty("x_min")
    private Double domainMin;

    @JsonProperty("x_max")
    private Double domainMax;

    public static FactorSettings of(double anchor, int numBasis, double smoothnessPenalty) {
        return FactorSettings.builder()
                .anchor(anchor)
                .numBasis(numBasis)
                .smoothnessPenalty(smoothnessPenalty)
                .build();
    }
}
