package com.ryuqq.jobqueue.core.handler;

/**
 * Job Payload가 Handler가 기대한 형태가 아닐 때 발생하는 예외.
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public class InvalidPayloadException extends RuntimeException {

    public InvalidPayloadException(String message) {
        super(message);
    }
}
