package com.calibration.splineengine.domain.model;

/**
 * I-spline 기저 구성. 동일한 구성은 항상 동일한 knot 배치를 만든다.
 */
public record BasisConfig(int nBasis, int degree, double xMin, double xMax) {

    public BasisConfig {
        if (nBasis < 1) {
            throw new IllegalArgumentException("nBasis must be >= 1");
        }
        if (degree < 0) {
            throw new IllegalArgumentException("degree must be >= 0");
        }
        if (!Double.isFinite(xMin) || !Double.isFinite(xMax)) {
            throw new IllegalArgumentException("domain bounds must be finite");
        }
        if (xMax <= xMin) {
            throw new IllegalArgumentException("xMax must be greater than xMin");
        }
    }

    public int interiorKnotCount() {
        return Math.max(0, nBasis - degree);
    }
}
