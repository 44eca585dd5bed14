package com.calibration.splineengine.api.dto;

import com.calibration.splineengine.domain.model.CalibrationArtifact;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * 저장된 보정 레코드로 (level_a, level_b) 조합의 확률을 재현하는 요청.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArtifactScoreRequest {

    @JsonProperty("artifact")
    private CalibrationArtifact artifact;

    @JsonProperty("points")
    private List<LevelPair> points;

    public record LevelPair(@JsonProperty("level_a") Double levelA,
                            @JsonProperty("level_b") Double levelB) {
    }
}
