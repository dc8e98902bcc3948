package com.regvalidator.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only course lookup keyed by course code. Safe to share between concurrent validations.
 */
public final class CourseCatalog {

    private final Map<String, CourseCatalogEntry> entries;

    private CourseCatalog(Map<String, CourseCatalogEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /** Later entries with the same code replace earlier ones. */
    public static CourseCatalog of(Collection<CourseCatalogEntry> entries) {
        Map<String, CourseCatalogEntry> byCode = new LinkedHashMap<>();
        for (CourseCatalogEntry entry : entries) {
            byCode.put(entry.code(), entry);
        }
        return new CourseCatalog(byCode);
    }

    public static CourseCatalog empty() {
        return new CourseCatalog(new LinkedHashMap<>());
    }

    public Optional<CourseCatalogEntry> lookup(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(code));
    }

    public boolean contains(String code) {
        return code != null && entries.containsKey(code);
    }

    public int size() {
        return entries.size();
    }

    public Collection<CourseCatalogEntry> entries() {
        return entries.values();
    }

    /** Courses whose requirements mention {@code code}, in catalog order. */
    public List<CourseCatalogEntry> dependentsOf(String code) {
        return entries.values().stream()
                .filter(e -> e.dependsOn(code))
                .toList();
    }
}
