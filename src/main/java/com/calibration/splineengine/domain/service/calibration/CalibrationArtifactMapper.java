package com.calibration.splineengine.domain.service.calibration;

import com.calibration.splineengine.domain.model.CalibrationArtifact;
import com.calibration.splineengine.domain.model.TwoFactorCalibration;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * 보정 결과를 하위 소비자가 읽는 영속 레코드로 변환한다. 필드명은 소비자가 이름으로
 * 바인딩하므로 모델 클래스의 @JsonProperty 에 고정되어 있다.
 */
@Component
@RequiredArgsConstructor
public class CalibrationArtifactMapper {

    static final String ARTIFACT_VERSION = "1.0.0";

    private final Clock clock;

    public CalibrationArtifact toArtifact(TwoFactorCalibration calibration, String description) {
        return CalibrationArtifact.builder()
                .version(ARTIFACT_VERSION)
                .calibratedAt(LocalDate.now(clock).toString())
                .description(description)
                .curveA(calibration.getCurveA())
                .curveB(calibration.getCurveB())
                .globalIntercept(calibration.getGlobalIntercept())
                .calibration(calibration.getDiagnostics())
                .build();
    }
}
