package com.ryuqq.jobqueue.core.resource;

import java.time.Instant;

/**
 * 외부 저장소의 빌드 레코드.
 *
 * <p>id가 0이면 아직 저장되지 않은 레코드입니다. {@code BuildStore.createBuild()}가 id를 부여합니다.</p>
 *
 * @param id 빌드 ID (미저장 시 0)
 * @param serviceId 빌드 대상 서비스 ID
 * @param repositoryUrl 소스 저장소 URL
 * @param gitRef 브랜치 또는 ref
 * @param contextPath 빌드 컨텍스트 경로
 * @param dockerfile Dockerfile 경로
 * @param imageTag 생성할 이미지 태그
 * @param status 빌드 상태
 * @param logPath 빌드 로그 파일 경로 (null 가능)
 * @param startedAt 빌드 시작 시각 (null 가능)
 * @param finishedAt 빌드 종료 시각 (null 가능)
 * @param createdAt 레코드 생성 시각
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public record Build(
    long id,
    long serviceId,
    String repositoryUrl,
    String gitRef,
    String contextPath,
    String dockerfile,
    String imageTag,
    BuildStatus status,
    String logPath,
    Instant startedAt,
    Instant finishedAt,
    Instant createdAt
) {

    public Build {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }

    /**
     * id만 변경한 새 인스턴스 생성.
     */
    public Build withId(long id) {
        return new Build(id, serviceId, repositoryUrl, gitRef, contextPath, dockerfile, imageTag, status, logPath, startedAt, finishedAt, createdAt);
    }

    /**
     * 상태 관련 필드를 변경한 새 인스턴스 생성.
     *
     * <p>null로 전달된 logPath, startedAt, finishedAt은 기존 값을 유지합니다.</p>
     */
    public Build withStatus(BuildStatus status, String logPath, Instant startedAt, Instant finishedAt) {
        return new Build(
            id, serviceId, repositoryUrl, gitRef, contextPath, dockerfile, imageTag,
            status,
            logPath != null ? logPath : this.logPath,
            startedAt != null ? startedAt : this.startedAt,
            finishedAt != null ? finishedAt : this.finishedAt,
            createdAt
        );
    }
}
