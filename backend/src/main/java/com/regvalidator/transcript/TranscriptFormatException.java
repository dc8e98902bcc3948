package com.regvalidator.transcript;

import lombok.Getter;

/**
 * Transcript cannot be read or is structurally broken (bad JSON, missing semesters, unknown semester type).
 * Fatal for that transcript only.
 */
@Getter
public class TranscriptFormatException extends RuntimeException {

    public static final String TRANSCRIPT_UNREADABLE = "TRANSCRIPT_UNREADABLE";
    public static final String TRANSCRIPT_INVALID = "TRANSCRIPT_INVALID";

    private final String errorCode;

    public TranscriptFormatException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TranscriptFormatException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
