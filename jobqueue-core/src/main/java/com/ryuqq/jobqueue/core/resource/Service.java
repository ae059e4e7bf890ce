package com.ryuqq.jobqueue.core.resource;

/**
 * 배포 대상 서비스.
 *
 * @param id 서비스 ID
 * @param projectId 소속 프로젝트 ID
 * @param name 서비스 이름 (이미지 태그 생성에 사용)
 * @param image 현재 실행 중인 이미지 참조
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public record Service(
    long id,
    long projectId,
    String name,
    String image
) {

    public Service {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    public Service withImage(String image) {
        return new Service(id, projectId, name, image);
    }
}
