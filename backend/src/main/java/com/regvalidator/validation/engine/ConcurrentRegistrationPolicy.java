package com.regvalidator.validation.engine;

import com.regvalidator.domain.PrerequisiteGroup;
import com.regvalidator.validation.engine.RegistrationHistory.Attempt;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether a prerequisite may be taken in the same semester as the course that depends on it.
 * <ul>
 *     <li>Failed-retake exception: the governing earlier attempt is exactly F (on a permissible registration)
 *     and the prerequisite is retaken this semester.</li>
 *     <li>Groups with {@code concurrentAllowed}: same-semester registration is enough, whatever the history.</li>
 * </ul>
 * In both cases a retake that was withdrawn (W) grants nothing.
 */
@Component
public class ConcurrentRegistrationPolicy {

    public Decision evaluate(String prerequisiteCode,
                             PrerequisiteGroup group,
                             Optional<Attempt> governing,
                             SemesterContext semester) {
        if (!semester.isRegistered(prerequisiteCode)) {
            return Decision.NOT_REGISTERED;
        }
        if (semester.allWithdrawn(prerequisiteCode)) {
            return Decision.RETAKE_WITHDRAWN;
        }
        if (group.concurrentAllowed()) {
            return Decision.ALLOWED;
        }
        if (governing.isPresent() && governing.get().isFailed() && !governing.get().isInvalid()) {
            return Decision.ALLOWED;
        }
        return Decision.NOT_ELIGIBLE;
    }

    public enum Decision {
        /** Concurrent registration permitted; the dependent relies on the same-semester registration. */
        ALLOWED,
        /** Prerequisite is not registered in this semester. */
        NOT_REGISTERED,
        /** Prerequisite is registered this semester but withdrawn. */
        RETAKE_WITHDRAWN,
        /** Registered concurrently without a previous failed attempt and without group permission. */
        NOT_ELIGIBLE
    }
}
