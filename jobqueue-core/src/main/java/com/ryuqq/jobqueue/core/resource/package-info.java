/**
 * Records owned by the external build/deploy store.
 *
 * <p>The store is authoritative for these records; the queue only updates their status
 * while a job runs.</p>
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.core.resource;
