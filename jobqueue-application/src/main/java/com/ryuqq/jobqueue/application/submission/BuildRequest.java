package com.ryuqq.jobqueue.application.submission;

/**
 * 빌드 요청.
 *
 * @param repositoryUrl 소스 저장소 URL (필수)
 * @param gitRef 브랜치 또는 ref (필수)
 * @param contextPath 빌드 컨텍스트 경로 (null이면 ".")
 * @param dockerfile Dockerfile 경로 (null이면 "Dockerfile")
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public record BuildRequest(
    String repositoryUrl,
    String gitRef,
    String contextPath,
    String dockerfile
) {

    public BuildRequest {
        if (repositoryUrl == null || repositoryUrl.isBlank()) {
            throw new IllegalArgumentException("repositoryUrl cannot be null or blank");
        }
        if (gitRef == null || gitRef.isBlank()) {
            throw new IllegalArgumentException("gitRef cannot be null or blank");
        }
        if (contextPath == null || contextPath.isBlank()) {
            contextPath = ".";
        }
        if (dockerfile == null || dockerfile.isBlank()) {
            dockerfile = "Dockerfile";
        }
    }
}
