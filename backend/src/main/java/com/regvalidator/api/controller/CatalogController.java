package com.regvalidator.api.controller;

import com.regvalidator.api.dto.CourseLookupResponse;
import com.regvalidator.api.dto.ErrorBody;
import com.regvalidator.api.validation.CatalogIdValidator;
import com.regvalidator.catalog.CatalogRegistry;
import com.regvalidator.domain.CourseCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /catalogs/{catalogId}/courses/{code}: course metadata and the courses that require it.
 */
@RestController
@RequestMapping("/api/v1/catalogs")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogIdValidator catalogIdValidator;
    private final CatalogRegistry catalogRegistry;

    @GetMapping("/{catalogId}/courses/{code}")
    public ResponseEntity<?> getCourse(@PathVariable String catalogId, @PathVariable String code) {
        if (!catalogIdValidator.isValidCatalogId(catalogId)) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_CATALOG_ID", "Invalid catalog id"));
        }
        CourseCatalog catalog = catalogRegistry.load(catalogId);
        String courseCode = code.trim();
        return catalog.lookup(courseCode)
                .<ResponseEntity<?>>map(entry -> ResponseEntity.ok(
                        CourseLookupResponse.of(catalogId, entry, catalog.dependentsOf(courseCode))))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("COURSE_NOT_FOUND", "Course " + courseCode + " is not in catalog " + catalogId)));
    }
}
