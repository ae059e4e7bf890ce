/**
 * Operation handlers for the built-in job kinds.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.application.handler.BuildJobHandler} - 이미지 빌드</li>
 *   <li>{@link com.ryuqq.jobqueue.application.handler.DeployJobHandler} - 서비스 이미지 교체</li>
 *   <li>{@link com.ryuqq.jobqueue.application.handler.ProgressReportingOutputStream} - 로그 줄 수 기반 진행률</li>
 * </ul>
 *
 * <p>Handler는 예외를 던져 실패를 알립니다. 메시지는 Job Record의 error에 그대로 기록됩니다.</p>
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.application.handler;
