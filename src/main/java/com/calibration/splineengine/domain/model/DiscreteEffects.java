package com.calibration.splineengine.domain.model;

/**
 * 1단계 가법 회귀가 만든 레벨별 이산 효과 (anchor 레벨 기준 중심화).
 * 연속 곡선 피팅의 입력으로만 쓰이며 영속 레코드에는 포함되지 않는다.
 */
public record DiscreteEffects(double[] levels, double[] effects) {

    public DiscreteEffects {
        levels = levels.clone();
        effects = effects.clone();
    }

    @Override
    public double[] levels() {
        return levels.clone();
    }

    @Override
    public double[] effects() {
        return effects.clone();
    }
}
