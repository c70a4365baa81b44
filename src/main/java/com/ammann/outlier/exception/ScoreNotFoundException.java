/* (C)2026 */
package com.ammann.outlier.exception;

/**
 * Thrown when the score repository holds no scores for the requested user, age group
 * or the whole population.
 *
 * <p>Mapped to HTTP 404 (Not Found) by {@link GlobalExceptionHandler}.
 */
public class ScoreNotFoundException extends ApiException {

    public ScoreNotFoundException(String message) {
        super(message);
    }

    public static ScoreNotFoundException forUser(String username) {
        return new ScoreNotFoundException("No scores found for user: " + username);
    }

    public static ScoreNotFoundException forAgeGroup(String ageGroup) {
        return new ScoreNotFoundException("No scores found for age group: " + ageGroup);
    }

    public static ScoreNotFoundException global() {
        return new ScoreNotFoundException("No scores found in database");
    }
}
