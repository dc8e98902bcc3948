package com.regvalidator.api.dto;

import com.regvalidator.domain.CourseCatalogEntry;
import com.regvalidator.domain.PrerequisiteGroup;

import java.util.List;

/**
 * GET /catalogs/{catalogId}/courses/{code}: the catalog entry plus the courses that depend on it.
 */
public record CourseLookupResponse(String catalogId,
                                   String code,
                                   String name,
                                   String credits,
                                   String category,
                                   List<String> prerequisites,
                                   List<String> corequisites,
                                   List<GroupEntry> prerequisiteGroups,
                                   List<String> dependents) {

    public static CourseLookupResponse of(String catalogId, CourseCatalogEntry entry, List<CourseCatalogEntry> dependents) {
        return new CourseLookupResponse(
                catalogId,
                entry.code(),
                entry.name(),
                entry.credits(),
                entry.category(),
                entry.prerequisites().stream().sorted().toList(),
                entry.corequisites().stream().sorted().toList(),
                entry.prerequisiteGroups().stream().map(GroupEntry::of).toList(),
                dependents.stream().map(CourseCatalogEntry::code).toList());
    }

    public record GroupEntry(List<String> courses, boolean concurrentAllowed) {

        static GroupEntry of(PrerequisiteGroup group) {
            return new GroupEntry(group.courses().stream().sorted().toList(), group.concurrentAllowed());
        }
    }
}
