package com.calibration.splineengine.domain.service.spline;

import com.calibration.splineengine.domain.service.optimizer.DifferentiableObjective;

/**
 * 가중 제곱오차 + 인접 계수 차이 평활 벌점.
 *
 * <p>파라미터 앞쪽 nBasis 개는 softplus 를 거쳐 양수 계수가 된다. anchor 가 있으면 절편은
 * 자유 파라미터가 아니라 매 평가마다 y0 - Σ c·I(x0) 로 결정되고, 없으면 마지막 파라미터가 절편이다.
 */
class MonotoneSplineObjective implements DifferentiableObjective {

    private final double[][] basis;
    private final double[] y;
    private final double[] weights;
    private final double smoothnessPenalty;
    private final double[] anchorRow;
    private final double anchorValue;
    private final int nBasis;

    MonotoneSplineObjective(double[][] basis, double[] y, double[] weights, double smoothnessPenalty,
                            double[] anchorRow, double anchorValue) {
        this.basis = basis;
        this.y = y;
        this.weights = weights;
        this.smoothnessPenalty = smoothnessPenalty;
        this.anchorRow = anchorRow;
        this.anchorValue = anchorValue;
        this.nBasis = basis.length > 0 ? basis[0].length : 0;
    }

    boolean anchored() {
        return anchorRow != null;
    }

    int dimension() {
        return anchored() ? nBasis : nBasis + 1;
    }

    double[] coefficients(double[] params) {
        double[] coef = new double[nBasis];
        for (int j = 0; j < nBasis; j++) coef[j] = softplus(params[j]);
        return coef;
    }

    double intercept(double[] params, double[] coef) {
        if (!anchored()) return params[nBasis];
        double sum = 0.0;
        for (int j = 0; j < nBasis; j++) sum += coef[j] * anchorRow[j];
        return anchorValue - sum;
    }

    @Override
    public double evaluate(double[] params, double[] gradient) {
        double[] coef = coefficients(params);
        double intercept = intercept(params, coef);

        double[] dCoef = new double[nBasis];
        double dIntercept = 0.0;
        double loss = 0.0;

        for (int i = 0; i < y.length; i++) {
            double[] row = basis[i];
            double pred = intercept;
            for (int j = 0; j < nBasis; j++) pred += coef[j] * row[j];
            double residual = y[i] - pred;
            loss += weights[i] * residual * residual;

            double common = -2.0 * weights[i] * residual;
            dIntercept += common;
            for (int j = 0; j < nBasis; j++) {
                double effective = anchored() ? row[j] - anchorRow[j] : row[j];
                dCoef[j] += common * effective;
            }
        }

        for (int j = 0; j + 1 < nBasis; j++) {
            double diff = coef[j + 1] - coef[j];
            loss += smoothnessPenalty * diff * diff;
            dCoef[j + 1] += 2.0 * smoothnessPenalty * diff;
            dCoef[j] -= 2.0 * smoothnessPenalty * diff;
        }

        for (int j = 0; j < nBasis; j++) {
            gradient[j] = dCoef[j] * sigmoid(params[j]);
        }
        if (!anchored()) {
            gradient[nBasis] = dIntercept;
        }
        return loss;
    }

    static double softplus(double t) {
        return Math.max(t, 0.0) + Math.log1p(Math.exp(-Math.abs(t)));
    }

    static double sigmoid(double t) {
        if (t >= 0) {
            return 1.0 / (1.0 + Math.exp(-t));
        }
        double e = Math.exp(t);
        return e / (1.0 + e);
    }
}
