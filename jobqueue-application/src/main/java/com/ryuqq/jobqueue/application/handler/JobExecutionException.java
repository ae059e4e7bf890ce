package com.ryuqq.jobqueue.application.handler;

/**
 * Handler 실행 실패.
 *
 * <p>외부 시스템 오류를 작업 단계와 대상 식별자로 감싼 예외입니다.
 * Worker는 이 메시지를 Job Record의 error에 그대로 기록합니다.</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public class JobExecutionException extends RuntimeException {

    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
