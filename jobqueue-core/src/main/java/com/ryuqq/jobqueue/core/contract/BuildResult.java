package com.ryuqq.jobqueue.core.contract;

import java.time.Duration;

/**
 * 이미지 빌드 결과.
 *
 * <p>런타임은 예외 없이 실패 결과를 반환할 수 있습니다 (예: Dockerfile 단계 실패).
 * 호출자는 예외와 {@code success=false} 결과를 모두 실패로 취급해야 합니다.</p>
 *
 * @param success 성공 여부
 * @param imageTag 빌드한 이미지 태그
 * @param duration 런타임이 측정한 빌드 시간
 * @param error 실패 상세 (성공 시 null)
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public record BuildResult(
    boolean success,
    String imageTag,
    Duration duration,
    String error
) {

    public BuildResult {
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    public static BuildResult succeeded(String imageTag, Duration duration) {
        return new BuildResult(true, imageTag, duration, null);
    }

    public static BuildResult failed(String imageTag, Duration duration, String error) {
        return new BuildResult(false, imageTag, duration, error);
    }
}
