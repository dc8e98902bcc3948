package com.regvalidator.batch;

/**
 * One transcript that produced no report.
 */
public record BatchJobFailure(String file, String errorCode, String message) {
}
