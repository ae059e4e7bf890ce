package com.ryuqq.jobqueue.application.handler;

import java.nio.file.Path;

/**
 * BuildJobHandler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>logDirectory: 빌드 로그 파일 디렉토리 (기본 ./logs/builds)</li>
 *   <li>estimatedLogLines: 예상 빌드 로그 줄 수 (기본 200, 0이면 줄 수 기반 진행률 미사용)</li>
 * </ul>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 * @param logDirectory 빌드 로그 디렉토리 (null 불가)
 * @param estimatedLogLines 예상 로그 줄 수 (0 이상)
 */
public record BuildHandlerConfig(
    Path logDirectory,
    int estimatedLogLines
) {

    /**
     * 기본 설정 생성자.
     */
    public BuildHandlerConfig() {
        this(Path.of("logs", "builds"), 200);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BuildHandlerConfig {
        if (logDirectory == null) {
            throw new IllegalArgumentException("logDirectory cannot be null");
        }
        if (estimatedLogLines < 0) {
            throw new IllegalArgumentException(
                "estimatedLogLines cannot be negative (current: " + estimatedLogLines + ")"
            );
        }
    }

    public BuildHandlerConfig withLogDirectory(Path logDirectory) {
        return new BuildHandlerConfig(logDirectory, estimatedLogLines);
    }

    public BuildHandlerConfig withEstimatedLogLines(int estimatedLogLines) {
        return new BuildHandlerConfig(logDirectory, estimatedLogLines);
    }
}
