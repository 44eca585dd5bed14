package com.calibration.splineengine.domain.service.calibration;

import com.calibration.splineengine.domain.exception.CalibrationConfigException;
import com.calibration.splineengine.domain.exception.CalibrationDataException;
import com.calibration.splineengine.domain.model.CalibrationDiagnostics;
import com.calibration.splineengine.domain.model.DiscreteEffects;
import com.calibration.splineengine.domain.model.FactorSettings;
import com.calibration.splineengine.domain.model.MonotoneFit;
import com.calibration.splineengine.domain.model.ObservationCell;
import com.calibration.splineengine.domain.model.SplineParameters;
import com.calibration.splineengine.domain.model.SurfaceCell;
import com.calibration.splineengine.domain.model.TwoFactorCalibration;
import com.calibration.splineengine.domain.service.optimizer.LbfgsMinimizer;
import com.calibration.splineengine.domain.service.optimizer.OptimizationResult;
import com.calibration.splineengine.domain.service.spline.MonotoneFitRequest;
import com.calibration.splineengine.domain.service.spline.MonotoneSplineFitter;
import com.calibration.splineengine.domain.service.spline.SplineEvaluator;
import com.calibration.splineengine.infra.monitor.FitMetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 2차원 확률 표에 두 개의 단조 곡선을 보정한다.
 *
 * <p>1단계는 레벨별 이산 효과를 logit 척도의 가법 모형으로 추정하고 (단조성은 벌점으로만 유도),
 * 2단계는 anchor 레벨 기준으로 중심화한 이산 효과를 단조 스플라인으로 다시 피팅한다.
 * 연속 곡선의 단조성은 2단계의 재매개화가 보장한다. 마지막으로 각 곡선이 자신의 anchor 입력에서
 * 정확히 0 이 되도록 절편을 다시 맞춘다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TwoFactorCalibrator {

    private final MonotoneSplineFitter fitter;
    private final SplineEvaluator evaluator;
    private final LbfgsMinimizer minimizer;
    private final TwoFactorProperties properties;
    private final FitMetricsRecorder metrics;

    public TwoFactorCalibration calibrate(List<ObservationCell> cells, double anchorA, double anchorB,
                                          int numBasis, double smoothnessPenalty) {
        return calibrate(cells,
                FactorSettings.of(anchorA, numBasis, smoothnessPenalty),
                FactorSettings.of(anchorB, numBasis, smoothnessPenalty));
    }

    public TwoFactorCalibration calibrate(List<ObservationCell> cells,
                                          FactorSettings factorA, FactorSettings factorB) {
        long startNano = System.nanoTime();
        if (factorA == null || factorB == null) {
            throw new CalibrationConfigException("두 요인의 보정 설정이 모두 필요합니다");
        }
        requireAnchor(factorA, "factor_a");
        requireAnchor(factorB, "factor_b");

        List<ObservationCell> included = validateCells(cells);
        int n = included.size();

        double[] observed = new double[n];
        double[] target = new double[n];
        double[] weights = new double[n];
        double[] rawA = new double[n];
        double[] rawB = new double[n];
        for (int k = 0; k < n; k++) {
            ObservationCell cell = included.get(k);
            observed[k] = clamp(cell.getProbability());
            target[k] = Math.log(observed[k] / (1.0 - observed[k]));
            weights[k] = cell.getWeight();
            rawA[k] = cell.getLevelA();
            rawB[k] = cell.getLevelB();
        }

        double[] levelsA = distinctSorted(rawA);
        double[] levelsB = distinctSorted(rawB);
        int[] indexA = indexOf(rawA, levelsA);
        int[] indexB = indexOf(rawB, levelsB);

        log.info("[TwoFactor] 보정 시작: cells={}, levelsA={}, levelsB={}",
                n, levelsA.length, levelsB.length);

        AdditiveEffectObjective objective = new AdditiveEffectObjective(
                indexA, indexB, target, weights, levelsA.length, levelsB.length,
                properties.getMonotonicityPenalty(), properties.getSmoothnessPenalty());

        double[] start = new double[objective.dimension()];
        fillLinear(start, 0, levelsA.length, properties.getInitialEffectSpan());
        fillLinear(start, levelsA.length, levelsB.length, properties.getInitialEffectSpan());

        OptimizationResult discrete = minimizer.minimize(objective, start, properties.optimizerSettings());
        if (!discrete.isConverged()) {
            log.warn("[TwoFactor] 이산 효과 최적화 미수렴, 최선 결과 사용: iterations={}, message={}",
                    discrete.getIterations(), discrete.getMessage());
        }

        double[] solution = discrete.getPoint();
        double[] alphaA = Arrays.copyOfRange(solution, 0, levelsA.length);
        double[] alphaB = Arrays.copyOfRange(solution, levelsA.length, solution.length);

        int anchorIndexA = nearestIndex(levelsA, factorA.getAnchor());
        int anchorIndexB = nearestIndex(levelsB, factorB.getAnchor());
        double globalIntercept = alphaA[anchorIndexA] + alphaB[anchorIndexB];

        double[] centeredA = center(alphaA, anchorIndexA);
        double[] centeredB = center(alphaB, anchorIndexB);
        warnIfDecreasing("A", centeredA);
        warnIfDecreasing("B", centeredB);

        MonotoneFit fitA = fitter.fit(toFitRequest(levelsA, centeredA, factorA));
        MonotoneFit fitB = fitter.fit(toFitRequest(levelsB, centeredB, factorB));

        SplineParameters curveA = reanchor(fitA.parameters(), factorA.getAnchor());
        SplineParameters curveB = reanchor(fitB.parameters(), factorB.getAnchor());

        boolean monotoneA = evaluator.isMonotone(curveA);
        boolean monotoneB = evaluator.isMonotone(curveB);

        double[] predicted = new double[n];
        for (int k = 0; k < n; k++) {
            predicted[k] = LatentScoreModel.sigmoid(alphaA[indexA[k]] + alphaB[indexB[k]]);
        }
        double[] fitStats = weightedFitStats(observed, predicted, weights);

        CalibrationDiagnostics diagnostics = CalibrationDiagnostics.builder()
                .rmse(fitStats[0])
                .r2(fitStats[1])
                .curveAMonotone(monotoneA)
                .curveBMonotone(monotoneB)
                .converged(discrete.isConverged())
                .iterations(discrete.getIterations())
                .anchorA(factorA.getAnchor())
                .anchorB(factorB.getAnchor())
                .curveAR2(fitA.diagnostics().getR2())
                .curveBR2(fitB.diagnostics().getR2())
                .curveAConverged(fitA.diagnostics().isConverged())
                .curveBConverged(fitB.diagnostics().isConverged())
                .globalIntercept(globalIntercept)
                .build();

        LatentScoreModel model = new LatentScoreModel(evaluator, curveA, curveB, globalIntercept);
        List<SurfaceCell> surface = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            surface.add(new SurfaceCell(rawA[k], rawB[k], observed[k],
                    model.probability(rawA[k], rawB[k]), weights[k]));
        }

        long elapsed = System.nanoTime() - startNano;
        metrics.recordCalibration(elapsed);
        log.info("[TwoFactor] 보정 완료: globalIntercept={}, rmse={}, r2={}, monotoneA={}, monotoneB={}, converged={}, elapsed={}ms",
                String.format("%.4f", globalIntercept),
                String.format("%.5f", fitStats[0]),
                String.format("%.4f", fitStats[1]),
                monotoneA, monotoneB, discrete.isConverged(), elapsed / 1_000_000);

        return TwoFactorCalibration.builder()
                .curveA(curveA)
                .curveB(curveB)
                .globalIntercept(globalIntercept)
                .diagnostics(diagnostics)
                .curveAFit(fitA.diagnostics())
                .curveBFit(fitB.diagnostics())
                .discreteA(new DiscreteEffects(levelsA, centeredA))
                .discreteB(new DiscreteEffects(levelsB, centeredB))
                .surface(List.copyOf(surface))
                .build();
    }

    private List<ObservationCell> validateCells(List<ObservationCell> cells) {
        if (cells == null || cells.isEmpty()) {
            throw new CalibrationDataException("cells", "관측 셀이 없습니다");
        }

        List<ObservationCell> included = new ArrayList<>(cells.size());
        for (int i = 0; i < cells.size(); i++) {
            ObservationCell cell = cells.get(i);
            String prefix = "cells[" + i + "]";
            if (cell == null) {
                throw new CalibrationDataException(prefix, prefix + " 셀이 비어 있습니다");
            }
            requireFinite(cell.getLevelA(), prefix + ".level_a");
            requireFinite(cell.getLevelB(), prefix + ".level_b");
            requireFinite(cell.getProbability(), prefix + ".probability");
            requireFinite(cell.getWeight(), prefix + ".weight");

            if (cell.getProbability() < 0.0 || cell.getProbability() > 1.0) {
                throw new CalibrationDataException(prefix + ".probability",
                        prefix + ".probability는 [0, 1] 범위여야 합니다: " + cell.getProbability());
            }
            if (cell.getWeight() < 0.0) {
                throw new CalibrationDataException(prefix + ".weight",
                        prefix + ".weight는 음수일 수 없습니다: " + cell.getWeight());
            }
            if (cell.getWeight() > 0.0) {
                included.add(cell);
            }
        }

        if (included.isEmpty()) {
            throw new CalibrationConfigException("모든 셀의 가중치가 0입니다");
        }
        if (included.size() < cells.size()) {
            log.debug("[TwoFactor] 가중치 0 셀 제외: excluded={}", cells.size() - included.size());
        }
        return included;
    }

    private void requireAnchor(FactorSettings settings, String factor) {
        if (settings.getAnchor() == null || !Double.isFinite(settings.getAnchor())) {
            throw new CalibrationConfigException(factor + ".anchor는 필수이며 유한값이어야 합니다");
        }
    }

    private void requireFinite(Double value, String field) {
        if (value == null) {
            throw new CalibrationDataException(field, field + " 필드가 누락되었습니다");
        }
        if (!Double.isFinite(value)) {
            throw new CalibrationDataException(field, field + " 값이 유한하지 않습니다: " + value);
        }
    }

    private MonotoneFitRequest toFitRequest(double[] levels, double[] effects, FactorSettings settings) {
        return MonotoneFitRequest.builder()
                .x(levels)
                .y(effects)
                .numBasis(settings.getNumBasis())
                .degree(settings.getDegree())
                .smoothnessPenalty(settings.getSmoothnessPenalty())
                .domainMin(settings.getDomainMin())
                .domainMax(settings.getDomainMax())
                .build();
    }

    // 이산 anchor 레벨과 실수 anchor 입력이 다를 수 있으므로 연속 곡선 기준으로 한 번 더 맞춘다.
    private SplineParameters reanchor(SplineParameters curve, double anchor) {
        double atAnchor = evaluator.evaluate(anchor, curve);
        return curve.withIntercept(curve.getIntercept() - atAnchor);
    }

    private double clamp(double p) {
        return Math.max(properties.getProbabilityFloor(), Math.min(properties.getProbabilityCeiling(), p));
    }

    private void warnIfDecreasing(String factor, double[] effects) {
        for (int i = 1; i < effects.length; i++) {
            if (effects[i] < effects[i - 1]) {
                log.warn("[TwoFactor] 이산 효과 단조성 위반 잔존, 연속 피팅에서 보정됨: factor={}, level={}, drop={}",
                        factor, i, effects[i - 1] - effects[i]);
                return;
            }
        }
    }

    static double[] weightedFitStats(double[] observed, double[] predicted, double[] weights) {
        double total = 0.0;
        double mean = 0.0;
        for (int k = 0; k < observed.length; k++) {
            total += weights[k];
            mean += weights[k] * observed[k];
        }
        mean /= total;

        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int k = 0; k < observed.length; k++) {
            double w = weights[k] / total;
            double residual = observed[k] - predicted[k];
            ssRes += w * residual * residual;
            double dev = observed[k] - mean;
            ssTot += w * dev * dev;
        }
        return new double[]{Math.sqrt(ssRes), ssTot > 0 ? 1.0 - ssRes / ssTot : 0.0};
    }

    static int nearestIndex(double[] levels, double anchor) {
        int best = 0;
        for (int i = 1; i < levels.length; i++) {
            if (Math.abs(levels[i] - anchor) < Math.abs(levels[best] - anchor)) {
                best = i;
            }
        }
        return best;
    }

    private static double[] center(double[] effects, int anchorIndex) {
        double[] out = new double[effects.length];
        double base = effects[anchorIndex];
        for (int i = 0; i < effects.length; i++) out[i] = effects[i] - base;
        return out;
    }

    private static void fillLinear(double[] target, int offset, int count, double span) {
        for (int i = 0; i < count; i++) {
            target[offset + i] = count == 1 ? -span : -span + 2.0 * span * i / (count - 1);
        }
    }

    private static double[] distinctSorted(double[] values) {
        return Arrays.stream(values).distinct().sorted().toArray();
    }

    private static int[] indexOf(double[] values, double[] levels) {
        int[] idx = new int[values.length];
        for (int k = 0; k < values.length; k++) {
            idx[k] = Arrays.binarySearch(levels, values[k]);
        }
        return idx;
    }
}
