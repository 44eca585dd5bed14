package com.calibration.splineengine.domain.service.calibration;

import com.calibration.splineengine.domain.service.optimizer.DifferentiableObjective;

import java.util.Arrays;

/**
 * logit 척도의 가법 모형 α_A[a] + α_B[b] 에 대한 가중 제곱오차.
 * 인접 레벨 간 감소는 큰 계수의 제곱 벌점으로, 인접 차이 자체는 작은 평활 벌점으로 억제한다.
 */
class AdditiveEffectObjective implements DifferentiableObjective {

    private final int[] indexA;
    private final int[] indexB;
    private final double[] target;
    private final double[] weights;
    private final int levelsA;
    private final int levelsB;
    private final double monotonicityPenalty;
    private final double smoothnessPenalty;

    AdditiveEffectObjective(int[] indexA, int[] indexB, double[] target, double[] weights,
                            int levelsA, int levelsB,
                            double monotonicityPenalty, double smoothnessPenalty) {
        this.indexA = indexA;
        this.indexB = indexB;
        this.target = target;
        this.weights = weights;
        this.levelsA = levelsA;
        this.levelsB = levelsB;
        this.monotonicityPenalty = monotonicityPenalty;
        this.smoothnessPenalty = smoothnessPenalty;
    }

    int dimension() {
        return levelsA + levelsB;
    }

    @Override
    public double evaluate(double[] params, double[] gradient) {
        Arrays.fill(gradient, 0.0);
        double loss = 0.0;

        for (int k = 0; k < target.length; k++) {
            int a = indexA[k];
            int b = levelsA + indexB[k];
            double residual = target[k] - params[a] - params[b];
            loss += weights[k] * residual * residual;
            double common = -2.0 * weights[k] * residual;
            gradient[a] += common;
            gradient[b] += common;
        }

        loss += shapePenalty(params, gradient, 0, levelsA);
        loss += shapePenalty(params, gradient, levelsA, levelsB);
        return loss;
    }

    private double shapePenalty(double[] params, double[] gradient, int offset, int count) {
        double penalty = 0.0;
        for (int i = offset; i + 1 < offset + count; i++) {
            double diff = params[i + 1] - params[i];
            double violation = Math.max(0.0, -diff);
            penalty += monotonicityPenalty * violation * violation + smoothnessPenalty * diff * diff;

            double dDiff = -2.0 * monotonicityPenalty * violation + 2.0 * smoothnessPenalty * diff;
            gradient[i + 1] += dDiff;
            gradient[i] -= dDiff;
        }
        return penalty;
    }
}
