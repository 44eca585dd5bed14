package com.calibration.splineengine.domain.service.spline;

import com.calibration.splineengine.domain.exception.CalibrationConfigException;
import com.calibration.splineengine.domain.exception.CalibrationDataException;
import com.calibration.splineengine.domain.model.AnchorPoint;
import com.calibration.splineengine.domain.model.BasisConfig;
import com.calibration.splineengine.domain.model.FitDiagnostics;
import com.calibration.splineengine.domain.model.MonotoneFit;
import com.calibration.splineengine.domain.model.SplineParameters;
import com.calibration.splineengine.domain.service.optimizer.LbfgsMinimizer;
import com.calibration.splineengine.domain.service.optimizer.OptimizationResult;
import com.calibration.splineengine.infra.monitor.FitMetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.SplittableRandom;

/**
 * I-spline 기저와 softplus 재매개화로 단조 증가 곡선을 피팅한다.
 *
 * <p>계수는 비제약 파라미터 t 에서 log(1+e^t) 로 만들어지므로 항상 양수이고, 곡선은
 * 박스 제약 없이도 단조가 보장된다. 0 초기값과 가우시안 섭동 초기값으로 여러 번 최적화한 뒤
 * 목적함수 값이 가장 낮은 결과를 채택한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonotoneSplineFitter {

    private final ISplineBasis basis;
    private final SplineEvaluator evaluator;
    private final LbfgsMinimizer minimizer;
    private final SplineFitProperties properties;
    private final FitMetricsRecorder metrics;

    public MonotoneFit fit(MonotoneFitRequest request) {
        long startNano = System.nanoTime();

        double[] x = request.getX();
        double[] y = request.getY();
        validateSamples(x, y);
        double[] weights = normalizedWeights(request.getWeights(), x.length);

        int degree = request.getDegree() != null ? request.getDegree() : properties.getDefaultDegree();
        double smoothness = request.getSmoothnessPenalty() != null
                ? request.getSmoothnessPenalty()
                : properties.getDefaultSmoothnessPenalty();
        BasisConfig config = resolveConfig(request, x, degree, smoothness);

        double[][] matrix = basis.build(x, config);
        AnchorPoint anchor = request.getAnchor();
        double[] anchorRow = anchor != null ? basis.buildRow(anchor.x(), config) : null;
        double anchorValue = anchor != null ? anchor.y() : 0.0;

        MonotoneSplineObjective objective = new MonotoneSplineObjective(
                matrix, y, weights, smoothness, anchorRow, anchorValue);

        double[] initial = new double[objective.dimension()];
        if (!objective.anchored()) {
            initial[config.nBasis()] = mean(y);
        }

        long seed = request.getSeed() != null ? request.getSeed() : properties.getSeed();
        OptimizationResult best = minimizeWithRestarts(objective, initial, seed);

        double[] params = best.getPoint();
        double[] coef = objective.coefficients(params);
        double intercept = objective.intercept(params, coef);

        SplineParameters parameters = SplineParameters.builder()
                .coefficients(toList(coef))
                .intercept(intercept)
                .numBasis(config.nBasis())
                .degree(config.degree())
                .domainMin(config.xMin())
                .domainMax(config.xMax())
                .knots(toList(basis.knots(config)))
                .build();

        FitDiagnostics diagnostics = diagnose(matrix, y, weights, coef, intercept, parameters, best);

        long elapsed = System.nanoTime() - startNano;
        metrics.recordSplineFit(elapsed, diagnostics.isConverged(), diagnostics.isMonotone());

        if (!diagnostics.isConverged()) {
            log.warn("[SplineFit] 최적화 미수렴, 최선 결과 반환: nBasis={}, iterations={}, message={}",
                    config.nBasis(), diagnostics.getIterations(), diagnostics.getMessage());
        }
        if (!diagnostics.isMonotone()) {
            log.warn("[SplineFit] 단조성 검사 실패: nBasis={}, domain=[{}, {}]",
                    config.nBasis(), config.xMin(), config.xMax());
        }
        log.info("[SplineFit] 피팅 완료: samples={}, nBasis={}, degree={}, anchored={}, rmse={}, r2={}, elapsed={}ms",
                x.length, config.nBasis(), config.degree(), anchor != null,
                String.format("%.5f", diagnostics.getRmse()),
                String.format("%.4f", diagnostics.getR2()),
                elapsed / 1_000_000);

        return new MonotoneFit(parameters, diagnostics);
    }

    private OptimizationResult minimizeWithRestarts(MonotoneSplineObjective objective,
                                                    double[] initial, long seed) {
        SplittableRandom rng = new SplittableRandom(seed);
        int restarts = Math.max(1, properties.getRestarts());
        OptimizationResult best = null;

        for (int trial = 0; trial < restarts; trial++) {
            double[] start = initial.clone();
            if (trial > 0) {
                for (int i = 0; i < start.length; i++) {
                    start[i] += rng.nextGaussian() * properties.getPerturbationScale();
                }
            }

            OptimizationResult result = minimizer.minimize(objective, start, properties.optimizerSettings());
            log.debug("[SplineFit] restart={}, loss={}, iterations={}, converged={}",
                    trial, result.getValue(), result.getIterations(), result.isConverged());

            if (best == null || result.getValue() < best.getValue()) {
                best = result;
            }
        }
        return best;
    }

    private FitDiagnostics diagnose(double[][] matrix, double[] y, double[] weights, double[] coef,
                                    double intercept, SplineParameters parameters,
                                    OptimizationResult result) {
        double weightedMean = 0.0;
        for (int i = 0; i < y.length; i++) weightedMean += weights[i] * y[i];

        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < y.length; i++) {
            double pred = intercept;
            for (int j = 0; j < coef.length; j++) pred += coef[j] * matrix[i][j];
            double residual = y[i] - pred;
            ssRes += weights[i] * residual * residual;
            double dev = y[i] - weightedMean;
            ssTot += weights[i] * dev * dev;
        }

        return FitDiagnostics.builder()
                .rmse(Math.sqrt(ssRes))
                .r2(ssTot > 0 ? 1.0 - ssRes / ssTot : 0.0)
                .monotone(evaluator.isMonotone(parameters))
                .converged(result.isConverged())
                .iterations(result.getIterations())
                .message(result.getMessage())
                .build();
    }

    private BasisConfig resolveConfig(MonotoneFitRequest request, double[] x, int degree, double smoothness) {
        if (request.getNumBasis() < 1) {
            throw new CalibrationConfigException("n_basis는 1 이상이어야 합니다: " + request.getNumBasis());
        }
        if (degree < 0) {
            throw new CalibrationConfigException("degree는 0 이상이어야 합니다: " + degree);
        }
        if (!(smoothness >= 0) || Double.isInfinite(smoothness)) {
            throw new CalibrationConfigException("smoothness_penalty는 0 이상의 유한값이어야 합니다: " + smoothness);
        }

        double xMin = request.getDomainMin() != null ? request.getDomainMin() : min(x);
        double xMax = request.getDomainMax() != null ? request.getDomainMax() : max(x);
        if (!Double.isFinite(xMin) || !Double.isFinite(xMax) || xMax <= xMin) {
            throw new CalibrationConfigException(
                    "도메인 경계가 올바르지 않습니다: x_min=" + xMin + ", x_max=" + xMax);
        }
        return new BasisConfig(request.getNumBasis(), degree, xMin, xMax);
    }

    private void validateSamples(double[] x, double[] y) {
        if (x == null) {
            throw new CalibrationDataException("x", "x는 필수입니다");
        }
        if (y == null) {
            throw new CalibrationDataException("y", "y는 필수입니다");
        }
        if (x.length == 0) {
            throw new CalibrationConfigException("피팅할 표본이 없습니다");
        }
        if (x.length != y.length) {
            throw new CalibrationConfigException(
                    "x와 y의 길이가 다릅니다: x=" + x.length + ", y=" + y.length);
        }
        for (int i = 0; i < x.length; i++) {
            if (!Double.isFinite(x[i])) {
                throw new CalibrationDataException("x[" + i + "]", "x[" + i + "] 값이 유한하지 않습니다");
            }
            if (!Double.isFinite(y[i])) {
                throw new CalibrationDataException("y[" + i + "]", "y[" + i + "] 값이 유한하지 않습니다");
            }
        }
    }

    private double[] normalizedWeights(double[] raw, int n) {
        double[] weights = new double[n];
        if (raw == null) {
            Arrays.fill(weights, 1.0 / n);
            return weights;
        }
        if (raw.length != n) {
            throw new CalibrationConfigException(
                    "weights 길이가 표본 수와 다릅니다: weights=" + raw.length + ", samples=" + n);
        }

        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(raw[i]) || raw[i] < 0) {
                throw new CalibrationDataException("weights[" + i + "]",
                        "weights[" + i + "]는 0 이상의 유한값이어야 합니다: " + raw[i]);
            }
            sum += raw[i];
        }
        if (sum <= 0) {
            throw new CalibrationConfigException("모든 가중치가 0입니다");
        }
        for (int i = 0; i < n; i++) weights[i] = raw[i] / sum;
        return weights;
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) list.add(v);
        return List.copyOf(list);
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    private static double min(double[] values) {
        double m = Double.POSITIVE_INFINITY;
        for (double v : values) m = Math.min(m, v);
        return m;
    }

    private static double max(double[] values) {
        double m = Double.NEGATIVE_INFINITY;
        for (double v : values) m = Math.max(m, v);
        return m;
    }
}
