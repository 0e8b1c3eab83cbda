package com.sitecheck.common.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorMessagesTest {

    @Test
    void truncatesToLimit() {
        String message = "x".repeat(1500);

        assertThat(ErrorMessages.truncate(message)).hasSize(ErrorMessages.MAX_ERROR_LENGTH);
        assertThat(ErrorMessages.truncate("short")).isEqualTo("short");
        assertThat(ErrorMessages.truncate(null)).isNull();
    }

    @Test
    void describesErrorsWithoutMessageByTypeAndCause() {
        RuntimeException error = new RuntimeException(null, new IllegalStateException("socket closed"));

        assertThat(ErrorMessages.describe(error)).isEqualTo("RuntimeException: socket closed");
        assertThat(ErrorMessages.describe(null)).isEqualTo("Unknown error");
    }
}
