/**
 * Value types exchanged with the container runtime.
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.core.contract;
