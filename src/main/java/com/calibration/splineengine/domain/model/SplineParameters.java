package com.calibration.splineengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 피팅된 단조 스플라인 곡선. 하위 확률 모델이 필드 이름으로 바인딩하므로
 * JSON 필드명은 변경하지 않는다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SplineParameters {

    @JsonProperty("coefficients")
    private List<Double> coefficients;

    @JsonProperty("intercept")
    private double intercept;

    @JsonProperty("n_basis")
    private int numBasis;

    @JsonProperty("degree")
    private int degree;

    @JsonProperty("x_min")
    private double domainMin;

    @JsonProperty("x_max")
    private double domainMax;

    @JsonProperty("knots")
    private List<Double> knots;

    public BasisConfig basisConfig() {
        return new BasisConfig(numBasis, degree, domainMin, domainMax);
    }

    public double[] coefficientArray() {
        double[] out = new double[coefficients.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = coefficients.get(i);
        }
        return out;
    }

    public SplineParameters withIntercept(double newIntercept) {
        return new SplineParameters(coefficients, newIntercept, numBasis, degree,
                domainMin, domainMax, knots);
    }
}
