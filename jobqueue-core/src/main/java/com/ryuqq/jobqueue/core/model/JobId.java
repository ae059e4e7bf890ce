package com.ryuqq.jobqueue.core.model;

/**
 * Job의 프로세스 내 고유 식별자.
 *
 * <p>JobId는 {@link JobIdGenerator}가 생성 시각(나노초) 기반으로 발급하며,
 * 호출자는 이 값으로 Job 상태를 조회합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public final class JobId {

    private final String value;

    private JobId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("JobId cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("JobId length cannot exceed 64 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("JobId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * JobId 생성.
     *
     * @param value JobId 값
     * @return JobId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static JobId of(String value) {
        return new JobId(value);
    }

    /**
     * JobId 값 조회.
     *
     * @return JobId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobId jobId = (JobId) o;
        return value.equals(jobId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "JobId{" + value + '}';
    }
}
