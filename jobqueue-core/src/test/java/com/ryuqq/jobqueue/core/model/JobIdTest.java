package com.ryuqq.jobqueue.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JobId Value Object 테스트.
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
class JobIdTest {

    @Test
    void of_ValidValue_CreatesJobId() {
        // Given
        String value = "1718000000123456789";

        // When
        JobId jobId = JobId.of(value);

        // Then
        assertEquals(value, jobId.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> JobId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_ValueExceeds64Characters_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> JobId.of("a".repeat(65)));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> JobId.of("job/1")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void equals_SameValue_AreEqual() {
        assertEquals(JobId.of("job-1"), JobId.of("job-1"));
        assertEquals(JobId.of("job-1").hashCode(), JobId.of("job-1").hashCode());
        assertNotEquals(JobId.of("job-1"), JobId.of("job-2"));
    }
}
