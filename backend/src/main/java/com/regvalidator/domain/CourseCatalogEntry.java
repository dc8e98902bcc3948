package com.regvalidator.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Catalog metadata for one course code. Corequisites are recorded but not validated.
 */
public record CourseCatalogEntry(String code,
                                 String name,
                                 String credits,
                                 String category,
                                 Set<String> prerequisites,
                                 Set<String> corequisites,
                                 List<PrerequisiteGroup> prerequisiteGroups) {

    public CourseCatalogEntry {
        prerequisites = prerequisites == null ? Set.of() : Set.copyOf(prerequisites);
        corequisites = corequisites == null ? Set.of() : Set.copyOf(corequisites);
        prerequisiteGroups = prerequisiteGroups == null ? List.of() : List.copyOf(prerequisiteGroups);
    }

    public boolean hasPrerequisites() {
        return !prerequisites.isEmpty() || prerequisiteGroups.stream().anyMatch(g -> !g.courses().isEmpty());
    }

    public boolean hasDeclaredGroups() {
        return prerequisiteGroups.stream().anyMatch(g -> !g.courses().isEmpty());
    }

    /**
     * Alternatives in evaluation order: the primary list as an implicit group without concurrent permission
     * (only when non-empty), followed by the declared groups. Any one satisfied alternative satisfies the entry.
     */
    public List<PrerequisiteGroup> alternatives() {
        List<PrerequisiteGroup> alternatives = new ArrayList<>();
        if (!prerequisites.isEmpty()) {
            alternatives.add(new PrerequisiteGroup(prerequisites, false));
        }
        prerequisiteGroups.stream()
                .filter(g -> !g.courses().isEmpty())
                .forEach(alternatives::add);
        return alternatives;
    }

    /** True when the primary list or any group mentions {@code code}. */
    public boolean dependsOn(String code) {
        return prerequisites.contains(code) || prerequisiteGroups.stream().anyMatch(g -> g.courses().contains(code));
    }
}
