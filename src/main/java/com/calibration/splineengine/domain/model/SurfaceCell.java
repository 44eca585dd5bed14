package com.calibration.splineengine.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 보정 결과가 재현한 셀 단위 확률. observed 는 clamp 이후 값이다.
 */
public record SurfaceCell(@JsonProperty("level_a") double levelA,
                          @JsonProperty("level_b") double levelB,
                          @JsonProperty("observed") double observed,
                          @JsonProperty("predicted") double predicted,
                          @JsonProperty("weight") double weight) {
}
