package com.calibration.splineengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 하위 확률 평가 컴포넌트가 읽는 보정 레코드.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CalibrationArtifact {

    @JsonProperty("version")
    private String version;

    @JsonProperty("calibrated_at")
    private String calibratedAt;

    @JsonProperty("description")
    private String description;

    @JsonProperty("curve_a")
    private SplineParameters curveA;

    @JsonProperty("curve_b")
    private SplineParameters curveB;

    @JsonProperty("global_intercept")
    private double globalIntercept;

    @JsonProperty("calibration")
    private CalibrationDiagnostics calibration;
}
