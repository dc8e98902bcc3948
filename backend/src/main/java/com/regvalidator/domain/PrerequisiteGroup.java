package com.regvalidator.domain;

import java.util.Set;

/**
 * One alternative way to satisfy a course requirement: every course in the group must be met.
 * With {@code concurrentAllowed} a member may also be taken in the same semester as the dependent course.
 */
public record PrerequisiteGroup(Set<String> courses, boolean concurrentAllowed) {

    public PrerequisiteGroup {
        courses = courses == null ? Set.of() : Set.copyOf(courses);
    }
}
