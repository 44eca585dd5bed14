package com.calibration.splineengine.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AnchorPoint(@JsonProperty("x") double x, @JsonProperty("y") double y) {

    public AnchorPoint {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("anchor must be finite");
        }
    }
}
