package com.ryuqq.jobqueue.core.model;

/**
 * 이미지 빌드 Job의 Payload.
 *
 * @param buildId 외부 저장소의 빌드 레코드 ID
 * @param repositoryUrl 소스 저장소 URL
 * @param gitRef 브랜치 또는 ref
 * @param contextPath 빌드 컨텍스트 경로
 * @param dockerfile Dockerfile 경로
 * @param imageTag 생성할 이미지 태그
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public record BuildPayload(
    long buildId,
    String repositoryUrl,
    String gitRef,
    String contextPath,
    String dockerfile,
    String imageTag
) implements JobPayload {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException repositoryUrl, gitRef 또는 imageTag가 비어있는 경우
     */
    public BuildPayload {
        if (repositoryUrl == null || repositoryUrl.isBlank()) {
            throw new IllegalArgumentException("repositoryUrl cannot be null or blank");
        }
        if (gitRef == null || gitRef.isBlank()) {
            throw new IllegalArgumentException("gitRef cannot be null or blank");
        }
        if (imageTag == null || imageTag.isBlank()) {
            throw new IllegalArgumentException("imageTag cannot be null or blank");
        }
    }

    @Override
    public JobKind kind() {
        return JobKind.BUILD;
    }
}
