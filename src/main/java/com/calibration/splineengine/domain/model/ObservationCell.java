package com.calibration.splineengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 2차원 확률 표의 한 셀. 입력 경로에서 누락될 수 있으므로 모든 필드는 nullable 이며
 * 보정 전에 검증된다.
 */
@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ObservationCell {

    @JsonProperty("level_a")
    private Double levelA;

    @JsonProperty("level_b")
    private Double levelB;

    @JsonProperty("probability")
    private Double probability;

    @JsonProperty("weight")
    private Double weight;

    public static ObservationCell of(double levelA, double levelB, double probability, double weight) {
        return new ObservationCell(levelA, levelB, probability, weight);
    }
}
