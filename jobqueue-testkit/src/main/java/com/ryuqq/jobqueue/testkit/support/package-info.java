/**
 * Contract Test 보조 도구 (관측용 Handler, 스냅샷 기록기).
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.testkit.support;
