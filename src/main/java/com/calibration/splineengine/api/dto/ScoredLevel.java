package com.calibration.splineengine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScoredLevel(@JsonProperty("level_a") double levelA,
                          @JsonProperty("level_b") double levelB,
                          @JsonProperty("score") double score,
                          @JsonProperty("logit") double logit,
                          @JsonProperty("probability") double probability) {
}
