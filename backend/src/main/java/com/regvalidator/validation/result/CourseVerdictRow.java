package com.regvalidator.validation.result;

import com.regvalidator.domain.ReasonKind;
import com.regvalidator.domain.VerdictStatus;

/**
 * One line of a semester's course table.
 */
public record CourseVerdictRow(String code,
                               String name,
                               String grade,
                               Integer credits,
                               VerdictStatus status,
                               ReasonKind reasonKind,
                               String reason) {
}
