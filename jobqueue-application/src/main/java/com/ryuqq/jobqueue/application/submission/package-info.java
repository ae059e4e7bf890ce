/**
 * Submission services: create the store record, then enqueue the job that processes it.
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.application.submission;
