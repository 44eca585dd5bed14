package com.calibration.splineengine.domain.service.spline;

import com.calibration.splineengine.domain.model.AnchorPoint;
import lombok.Builder;
import lombok.Getter;

/**
 * 단조 스플라인 피팅 입력. weights, anchor, 도메인 경계, seed 는 생략 가능하다.
 */
@Getter
@Builder
public class MonotoneFitRequest {

    private final double[] x;
    private final double[] y;
    private final double[] weights;

    @Builder.Default
    private final int numBasis = 6;

    private final Integer degree;
    private final Double smoothnessPenalty;
    private final AnchorPoint anchor;
    private final Double domainMin;
    private final Double domainMax;
    private final Long seed;
}
