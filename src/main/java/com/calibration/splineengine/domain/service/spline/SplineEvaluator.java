package com.calibration.splineengine.domain.service.spline;

import com.calibration.splineengine.domain.model.BasisConfig;
import com.calibration.splineengine.domain.model.SplineParameters;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 피팅된 파라미터로 곡선 값을 재현한다. 피팅 때와 같은 ISplineBasis 구성을 쓰므로
 * 결과는 항상 동일하며 입력을 변경하지 않는다.
 */
@Component
@RequiredArgsConstructor
public class SplineEvaluator {

    private final ISplineBasis basis;
    private final SplineFitProperties properties;

    public double[] evaluate(double[] points, SplineParameters parameters) {
        if (parameters.getCoefficients() == null) {
            throw new IllegalArgumentException("coefficients must not be null");
        }
        double[][] matrix = basis.build(points, parameters.basisConfig());
        double[] coef = parameters.coefficientArray();
        if (coef.length != parameters.getNumBasis()) {
            throw new IllegalArgumentException("coefficient count " + coef.length
                    + " does not match n_basis " + parameters.getNumBasis());
        }

        double[] values = new double[points.length];
        for (int p = 0; p < points.length; p++) {
            double v = parameters.getIntercept();
            for (int j = 0; j < coef.length; j++) v += coef[j] * matrix[p][j];
            values[p] = v;
        }
        return values;
    }

    public double evaluate(double point, SplineParameters parameters) {
        return evaluate(new double[]{point}, parameters)[0];
    }

    /**
     * [xMin, xMax] 균등 격자에서 인접 값이 허용 오차 이상 감소하지 않는지 확인한다.
     */
    public boolean isMonotone(SplineParameters parameters) {
        BasisConfig config = parameters.basisConfig();
        int gridSize = Math.max(properties.getMonotonicityGridSize(), 2);
        double[] grid = new double[gridSize];
        double step = (config.xMax() - config.xMin()) / (gridSize - 1);
        for (int i = 0; i < gridSize; i++) grid[i] = config.xMin() + i * step;
        grid[gridSize - 1] = config.xMax();

        double[] values = evaluate(grid, parameters);
        for (int i = 1; i < values.length; i++) {
            if (values[i] - values[i - 1] < -properties.getMonotonicityTolerance()) {
                return false;
            }
        }
        return true;
    }
}
