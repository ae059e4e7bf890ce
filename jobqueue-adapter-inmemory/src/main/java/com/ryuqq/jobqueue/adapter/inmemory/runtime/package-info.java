/**
 * Scriptable container runtime for tests and local runs.
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.adapter.inmemory.runtime;
