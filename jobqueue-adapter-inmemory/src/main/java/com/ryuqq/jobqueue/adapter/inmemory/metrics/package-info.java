/**
 * Counter-backed metrics sink.
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.adapter.inmemory.metrics;
