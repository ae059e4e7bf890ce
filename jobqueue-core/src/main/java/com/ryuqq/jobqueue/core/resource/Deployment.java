package com.ryuqq.jobqueue.core.resource;

import java.time.Instant;

/**
 * 외부 저장소의 배포 레코드.
 *
 * @param id 배포 ID (미저장 시 0)
 * @param serviceId 대상 서비스 ID
 * @param imageTag 배포할 이미지 태그
 * @param status 배포 상태
 * @param reason 배포 사유 또는 실패 사유 (null 가능)
 * @param createdAt 레코드 생성 시각
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public record Deployment(
    long id,
    long serviceId,
    String imageTag,
    DeploymentStatus status,
    String reason,
    Instant createdAt
) {

    public Deployment {
        if (imageTag == null || imageTag.isBlank()) {
            throw new IllegalArgumentException("imageTag cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }

    public Deployment withId(long id) {
        return new Deployment(id, serviceId, imageTag, status, reason, createdAt);
    }

    /**
     * 상태를 변경한 새 인스턴스 생성. reason이 null이면 기존 사유를 유지합니다.
     */
    public Deployment withStatus(DeploymentStatus status, String reason) {
        return new Deployment(id, serviceId, imageTag, status, reason != null ? reason : this.reason, createdAt);
    }
}
