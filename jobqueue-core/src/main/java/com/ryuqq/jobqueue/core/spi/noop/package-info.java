/**
 * No-op SPI implementations.
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.core.spi.noop;
