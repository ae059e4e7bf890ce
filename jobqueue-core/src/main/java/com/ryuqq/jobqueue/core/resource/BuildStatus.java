package com.ryuqq.jobqueue.core.resource;

/**
 * 외부 저장소에 기록되는 빌드 상태.
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public enum BuildStatus {

    QUEUED("queued"),
    BUILDING("building"),
    SUCCESS("success"),
    FAILED("failed");

    private final String wireName;

    BuildStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
