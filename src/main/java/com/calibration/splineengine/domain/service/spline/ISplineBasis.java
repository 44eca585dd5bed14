package com.calibration.splineengine.domain.service.spline;

import com.calibration.splineengine.domain.model.BasisConfig;
import org.springframework.stereotype.Component;

/**
 * 단조 증가 I-spline 기저.
 *
 * <p>n+1 개의 B-spline 을 만든 뒤 첫 번째 함수를 버리고, 뒤쪽부터 누적합을 취해
 * 국소 지지 함수를 전역 단조 램프 함수로 바꾼다. 각 열은 xMax 에서의 값으로 정규화되어
 * xMin 에서 0, xMax 에서 1 이 된다. 도메인 밖의 점은 경계 구간의 다항식으로 외삽한다.
 */
@Component
public class ISplineBasis {

    public double[] knots(BasisConfig config) {
        int degree = config.degree();
        int interior = config.interiorKnotCount();
        double xMin = config.xMin();
        double xMax = config.xMax();

        double[] knots = new double[2 * (degree + 1) + interior];
        int idx = 0;
        for (int i = 0; i <= degree; i++) knots[idx++] = xMin;
        double width = (xMax - xMin) / (interior + 1);
        for (int i = 1; i <= interior; i++) knots[idx++] = xMin + i * width;
        for (int i = 0; i <= degree; i++) knots[idx++] = xMax;
        return knots;
    }

    /**
     * points 의 각 점마다 nBasis 개의 I-spline 값을 갖는 행렬을 만든다.
     *
     * <p>nBasis 가 degree 보다 작으면 clamped knot 벡터가 degree+1 개의 B-spline 을 만들므로
     * 전체 집합으로 누적합을 구한 뒤 앞쪽 nBasis 개 열만 쓴다. 모든 열은 여전히 0 에서 1 로 오르는 램프다.
     */
    public double[][] build(double[] points, BasisConfig config) {
        double[] knots = knots(config);
        int nBasis = config.nBasis();
        int functionCount = Math.max(nBasis + 1, knots.length - config.degree() - 1);

        double[] norm = cumulativeFromRight(
                bsplineRow(config.xMax(), knots, config.degree(), functionCount), nBasis);
        for (int j = 0; j < nBasis; j++) {
            if (norm[j] == 0.0) norm[j] = 1.0;
        }

        double[][] basis = new double[points.length][];
        for (int p = 0; p < points.length; p++) {
            double[] row = cumulativeFromRight(
                    bsplineRow(points[p], knots, config.degree(), functionCount), nBasis);
            for (int j = 0; j < nBasis; j++) row[j] /= norm[j];
            basis[p] = row;
        }
        return basis;
    }

    public double[] buildRow(double point, BasisConfig config) {
        return build(new double[]{point}, config)[0];
    }

    /**
     * 첫 함수를 제외한 B-spline 값들의 오른쪽 누적합 중 앞쪽 columns 개.
     */
    private double[] cumulativeFromRight(double[] bspline, int columns) {
        double[] out = new double[columns];
        double running = 0.0;
        for (int j = bspline.length - 2; j >= 0; j--) {
            running += bspline[j + 1];
            if (j < columns) out[j] = running;
        }
        return out;
    }

    /**
     * x 에서 처음 count 개의 B-spline 함수 값. knot 수가 허용하는 함수 개수보다 많이
     * 요청되면 나머지는 0 이다.
     */
    double[] bsplineRow(double x, double[] knots, int degree, int count) {
        int functionCount = knots.length - degree - 1;
        int span = findSpan(x, knots, degree, functionCount);

        double[] local = new double[degree + 1];
        double[] left = new double[degree + 1];
        double[] right = new double[degree + 1];
        local[0] = 1.0;
        for (int j = 1; j <= degree; j++) {
            left[j] = x - knots[span + 1 - j];
            right[j] = knots[span + j] - x;
            double saved = 0.0;
            for (int r = 0; r < j; r++) {
                double temp = local[r] / (right[r + 1] + left[j - r]);
                local[r] = saved + right[r + 1] * temp;
                saved = left[j - r] * temp;
            }
            local[j] = saved;
        }

        double[] row = new double[count];
        for (int r = 0; r <= degree; r++) {
            int index = span - degree + r;
            if (index >= 0 && index < count) {
                row[index] = local[r];
            }
        }
        return row;
    }

    // 오른쪽 끝(xMax)은 마지막 구간에 포함된다. 도메인 밖은 양 끝 구간을 그대로 쓴다.
    private int findSpan(double x, double[] knots, int degree, int functionCount) {
        int low = degree;
        int high = functionCount - 1;
        if (x >= knots[high + 1]) return high;
        if (x <= knots[low]) return low;

        int span = low;
        for (int i = low; i <= high; i++) {
            if (knots[i] <= x && knots[i] < knots[i + 1]) {
                span = i;
            }
        }
        return span;
    }
}
