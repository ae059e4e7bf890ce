package com.ryuqq.jobqueue.core.model;

/**
 * 배포 Job의 Payload.
 *
 * @param deploymentId 외부 저장소의 배포 레코드 ID
 * @param serviceId 대상 서비스 ID
 * @param imageTag 교체할 이미지 태그
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public record DeployPayload(
    long deploymentId,
    long serviceId,
    String imageTag
) implements JobPayload {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException imageTag가 비어있는 경우
     */
    public DeployPayload {
        if (imageTag == null || imageTag.isBlank()) {
            throw new IllegalArgumentException("imageTag cannot be null or blank");
        }
    }

    @Override
    public JobKind kind() {
        return JobKind.DEPLOY;
    }
}
