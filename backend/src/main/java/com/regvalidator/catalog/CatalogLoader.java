package com.regvalidator.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.regvalidator.domain.CourseCatalog;
import com.regvalidator.domain.CourseCatalogEntry;
import com.regvalidator.domain.PrerequisiteGroup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses catalog JSON into an immutable {@link CourseCatalog}.
 * <p>
 * Accepts either a top-level array of course records or an object with curriculum sections
 * ({@code courses}, {@code industrial_engineering_courses}, {@code other_related_courses},
 * {@code technical_electives} as arrays, {@code gen_ed_courses} as sub-category to array).
 * Duplicate codes: later record wins.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogLoader {

    public static final String CATEGORY_GENERAL = "general";
    public static final String CATEGORY_IE_CORE = "ie_core";
    public static final String CATEGORY_GEN_ED = "gen_ed";
    public static final String CATEGORY_TECHNICAL_ELECTIVES = "technical_electives";

    private static final String GEN_ED_SECTION = "gen_ed_courses";

    /** Array sections in load order, with the category each one assigns. */
    private static final Map<String, String> ARRAY_SECTIONS = new LinkedHashMap<>();

    static {
        ARRAY_SECTIONS.put("courses", CATEGORY_GENERAL);
        ARRAY_SECTIONS.put("industrial_engineering_courses", CATEGORY_IE_CORE);
        ARRAY_SECTIONS.put("other_related_courses", CATEGORY_IE_CORE);
        ARRAY_SECTIONS.put("technical_electives", CATEGORY_TECHNICAL_ELECTIVES);
    }

    private final ObjectMapper objectMapper;

    public CourseCatalog load(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (NoSuchFileException e) {
            throw new CatalogLoadException(CatalogLoadException.CATALOG_NOT_FOUND,
                    "Catalog file not found: " + file, e);
        } catch (IOException e) {
            throw new CatalogLoadException(CatalogLoadException.CATALOG_UNREADABLE,
                    "Cannot read catalog file " + file + ": " + e.getMessage(), e);
        }
        CourseCatalog catalog = parse(json, file.getFileName().toString());
        log.info("Loaded catalog {} with {} courses", file, catalog.size());
        return catalog;
    }

    /**
     * @param source name used in error messages and logs
     */
    public CourseCatalog parse(String json, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CatalogLoadException(CatalogLoadException.CATALOG_UNREADABLE,
                    "Catalog " + source + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new CatalogLoadException(CatalogLoadException.CATALOG_INVALID, "Catalog " + source + " is empty");
        }

        Map<String, CourseCatalogEntry> byCode = new LinkedHashMap<>();
        if (root.isArray()) {
            readSection(root, CATEGORY_GENERAL, source, byCode);
        } else if (root.isObject()) {
            boolean anySection = false;
            for (Map.Entry<String, String> section : ARRAY_SECTIONS.entrySet()) {
                JsonNode node = root.path(section.getKey());
                if (node.isMissingNode() || node.isNull()) {
                    continue;
                }
                if (!node.isArray()) {
                    throw new CatalogLoadException(CatalogLoadException.CATALOG_INVALID,
                            "Catalog " + source + ": section '" + section.getKey() + "' must be an array");
                }
                anySection = true;
                readSection(node, section.getValue(), source, byCode);
            }
            JsonNode genEd = root.path(GEN_ED_SECTION);
            if (genEd.isObject()) {
                anySection = true;
                Iterator<Map.Entry<String, JsonNode>> categories = genEd.fields();
                while (categories.hasNext()) {
                    Map.Entry<String, JsonNode> category = categories.next();
                    if (!category.getValue().isArray()) {
                        throw new CatalogLoadException(CatalogLoadException.CATALOG_INVALID, "Catalog " + source
                                + ": gen-ed category '" + category.getKey() + "' must be an array");
                    }
                    readSection(category.getValue(), CATEGORY_GEN_ED, source, byCode);
                }
            } else if (!genEd.isMissingNode() && !genEd.isNull()) {
                throw new CatalogLoadException(CatalogLoadException.CATALOG_INVALID,
                        "Catalog " + source + ": section '" + GEN_ED_SECTION + "' must be an object");
            }
            if (!anySection) {
                throw new CatalogLoadException(CatalogLoadException.CATALOG_INVALID,
                        "Catalog " + source + " contains no course sections");
            }
        } else {
            throw new CatalogLoadException(CatalogLoadException.CATALOG_INVALID,
                    "Catalog " + source + " must be an array or an object");
        }
        return CourseCatalog.of(byCode.values());
    }

    private void readSection(JsonNode section, String category, String source, Map<String, CourseCatalogEntry> byCode) {
        int position = 0;
        for (JsonNode course : section) {
            position++;
            CourseCatalogEntry entry = readEntry(course, category, source, position);
            if (byCode.remove(entry.code()) != null) {
                log.warn("Catalog {}: duplicate course code {}, later record wins", source, entry.code());
            }
            byCode.put(entry.code(), entry);
        }
    }

    private CourseCatalogEntry readEntry(JsonNode course, String category, String source, int position) {
        if (!course.isObject()) {
            throw new CatalogLoadException(CatalogLoadException.CATALOG_INVALID,
                    "Catalog " + source + ": record " + position + " in " + category + " is not an object");
        }
        String code = requiredText(course, "code", category, source, position);
        String name = requiredText(course, "name", category, source, position);
        String credits = requiredText(course, "credits", category, source, position);
        return new CourseCatalogEntry(
                code,
                name,
                credits,
                category,
                codes(course.path("prerequisites")),
                codes(course.path("corequisites")),
                groups(course.path("prerequisite_groups"), code, source));
    }

    private static String requiredText(JsonNode course, String field, String category, String source, int position) {
        JsonNode value = course.get(field);
        if (value == null || value.isNull() || value.isContainerNode() || value.asText().isBlank()) {
            throw new CatalogLoadException(CatalogLoadException.CATALOG_INVALID, "Catalog " + source + ": record "
                    + position + " in " + category + " is missing required field '" + field + "'");
        }
        return value.asText().trim();
    }

    private static Set<String> codes(JsonNode array) {
        Set<String> codes = new LinkedHashSet<>();
        if (array.isArray()) {
            for (JsonNode code : array) {
                String text = code.asText("").trim();
                if (!text.isEmpty()) {
                    codes.add(text);
                }
            }
        }
        return codes;
    }

    private List<PrerequisiteGroup> groups(JsonNode array, String code, String source) {
        List<PrerequisiteGroup> groups = new ArrayList<>();
        if (!array.isArray()) {
            return groups;
        }
        for (JsonNode group : array) {
            Set<String> courses = codes(group.path("courses"));
            if (courses.isEmpty()) {
                log.warn("Catalog {}: course {} has a prerequisite group without courses, ignored", source, code);
                continue;
            }
            groups.add(new PrerequisiteGroup(courses, group.path("concurrent_allowed").asBoolean(false)));
        }
        return groups;
    }
}
