package com.calibration.splineengine.api.dto;

import com.calibration.splineengine.domain.model.FactorSettings;
import com.calibration.splineengine.domain.model.ObservationCell;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TwoFactorCalibrationRequest {

    @JsonProperty("cells")
    private List<ObservationCell> cells;

    @JsonProperty("factor_a")
    private FactorSettings factorA;

    @JsonProperty("factor_b")
    private FactorSettings factorB;

    @JsonProperty("description")
    private String description;
}
