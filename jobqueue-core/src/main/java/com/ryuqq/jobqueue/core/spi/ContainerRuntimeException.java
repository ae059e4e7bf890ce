package com.ryuqq.jobqueue.core.spi;

/**
 * 컨테이너 런타임 호출 실패.
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public class ContainerRuntimeException extends RuntimeException {

    public ContainerRuntimeException(String message) {
        super(message);
    }

    public ContainerRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
