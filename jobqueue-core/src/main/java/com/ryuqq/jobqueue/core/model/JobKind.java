package com.ryuqq.jobqueue.core.model;

import java.util.regex.Pattern;

/**
 * Job 종류 구분자.
 *
 * <p>JobKind는 어떤 {@code JobHandler}가 Job을 실행할지 결정합니다.
 * 기본 제공 종류는 {@link #BUILD}와 {@link #DEPLOY}이며, {@link #of(String)}로 확장할 수 있습니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~50자</li>
 *   <li>패턴: 소문자, 숫자, 언더스코어만 허용 (예: build, cert_issue)</li>
 * </ul>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public final class JobKind {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z0-9_]+$");

    /**
     * 컨테이너 이미지 빌드.
     */
    public static final JobKind BUILD = new JobKind("build");

    /**
     * 서비스 배포.
     */
    public static final JobKind DEPLOY = new JobKind("deploy");

    private final String value;

    private JobKind(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("JobKind cannot be null or blank");
        }
        if (value.length() > 50) {
            throw new IllegalArgumentException("JobKind length cannot exceed 50 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("JobKind must contain only lowercase letters, digits and underscores");
        }
        this.value = value;
    }

    /**
     * JobKind 생성.
     *
     * @param value JobKind 값 (예: build, deploy)
     * @return JobKind 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static JobKind of(String value) {
        return new JobKind(value);
    }

    /**
     * JobKind 값 조회.
     *
     * @return JobKind 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobKind jobKind = (JobKind) o;
        return value.equals(jobKind.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
