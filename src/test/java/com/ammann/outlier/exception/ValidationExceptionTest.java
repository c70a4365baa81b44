/* (C)2026 */
package com.ammann.outlier.exception;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ValidationExceptionTest {

    @Test
    void invalidParameterNamesParameterAndExpectation() {
        ValidationException exception =
                ValidationException.invalidParameter("days", 0, "between 1 and 3650");

        assertThat(exception.getMessage())
                .isEqualTo("Invalid parameter 'days': got '0', expected between 1 and 3650");
    }

    @Test
    void scoreNotFoundMessages() {
        assertThat(ScoreNotFoundException.forAgeGroup("18-25").getMessage())
                .isEqualTo("No scores found for age group: 18-25");
        assertThat(ScoreNotFoundException.global().getMessage()).isEqualTo("No scores found in database");
    }
}
