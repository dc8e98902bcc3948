package com.regvalidator.validation.result;

/**
 * Non-blocking notice that a semester's registered credits exceed the usual cap.
 */
public record CreditWarning(String semesterLabel, int registeredCredits, int limit, String message) {
}
