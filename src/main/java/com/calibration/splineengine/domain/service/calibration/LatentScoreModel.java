package com.calibration.splineengine.domain.service.calibration;

import com.calibration.splineengine.domain.exception.CalibrationDataException;
import com.calibration.splineengine.domain.model.CalibrationArtifact;
import com.calibration.splineengine.domain.model.SplineParameters;
import com.calibration.splineengine.domain.service.spline.SplineEvaluator;

/**
 * 보정된 두 곡선을 하위 확률 모델이 쓰는 방식 그대로 결합한다.
 * score = f_A(a) + f_B(b), P = sigmoid(globalIntercept + score).
 */
public class LatentScoreModel {

    private final SplineEvaluator evaluator;
    private final SplineParameters curveA;
    private final SplineParameters curveB;
    private final double globalIntercept;

    public LatentScoreModel(SplineEvaluator evaluator, SplineParameters curveA,
                            SplineParameters curveB, double globalIntercept) {
        this.evaluator = evaluator;
        this.curveA = curveA;
        this.curveB = curveB;
        this.globalIntercept = globalIntercept;
    }

    public static LatentScoreModel from(CalibrationArtifact artifact, SplineEvaluator evaluator) {
        if (artifact == null) {
            throw new CalibrationDataException("artifact", "보정 레코드가 없습니다");
        }
        if (artifact.getCurveA() == null || artifact.getCurveB() == null) {
            throw new CalibrationDataException("artifact.curve_a/curve_b", "보정 레코드에 곡선이 없습니다");
        }
        return new LatentScoreModel(evaluator, artifact.getCurveA(), artifact.getCurveB(),
                artifact.getGlobalIntercept());
    }

    public double score(double levelA, double levelB) {
        return evaluator.evaluate(levelA, curveA) + evaluator.evaluate(levelB, curveB);
    }

    public double logit(double levelA, double levelB) {
        return globalIntercept + score(levelA, levelB);
    }

    public double probability(double levelA, double levelB) {
        return sigmoid(logit(levelA, levelB));
    }

    public static double sigmoid(double z) {
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }
}
