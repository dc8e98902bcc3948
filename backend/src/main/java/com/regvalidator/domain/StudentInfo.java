package com.regvalidator.domain;

/**
 * Student header fields echoed into reports. All values are display strings as read from the transcript.
 */
public record StudentInfo(String id, String name, String fieldOfStudy, String admissionDate) {

    public static StudentInfo unknown() {
        return new StudentInfo("", "", "", "");
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }
}
