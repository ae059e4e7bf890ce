package com.ryuqq.jobqueue.core.resource;

/**
 * 외부 저장소에 기록되는 배포 상태.
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public enum DeploymentStatus {

    QUEUED("queued"),
    DEPLOYING("deploying"),
    SUCCESS("success"),
    FAILED("failed"),
    ROLLED_BACK("rolled_back");

    private final String wireName;

    DeploymentStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
