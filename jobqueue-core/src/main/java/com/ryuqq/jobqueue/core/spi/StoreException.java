package com.ryuqq.jobqueue.core.spi;

/**
 * 빌드/배포 저장소 작업 실패.
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
