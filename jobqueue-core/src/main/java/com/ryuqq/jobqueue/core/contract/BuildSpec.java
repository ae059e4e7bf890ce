package com.ryuqq.jobqueue.core.contract;

import java.io.OutputStream;

/**
 * 컨테이너 런타임에 전달하는 이미지 빌드 명세.
 *
 * @param repositoryUrl 소스 저장소 URL
 * @param gitRef 브랜치 또는 ref
 * @param contextPath 빌드 컨텍스트 경로
 * @param dockerfile Dockerfile 경로
 * @param imageTag 생성할 이미지 태그
 * @param logSink 빌드 로그 출력 대상 (런타임이 닫지 않음)
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public record BuildSpec(
    String repositoryUrl,
    String gitRef,
    String contextPath,
    String dockerfile,
    String imageTag,
    OutputStream logSink
) {

    public BuildSpec {
        if (imageTag == null || imageTag.isBlank()) {
            throw new IllegalArgumentException("imageTag cannot be null or blank");
        }
        if (logSink == null) {
            throw new IllegalArgumentException("logSink cannot be null");
        }
    }
}
