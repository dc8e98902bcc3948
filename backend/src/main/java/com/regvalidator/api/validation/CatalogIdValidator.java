package com.regvalidator.api.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validates catalog ids used to resolve {@code <directory>/<catalogId>.json}; path separators are never allowed.
 */
@Component
public class CatalogIdValidator {

    private static final Pattern CATALOG_ID = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

    public boolean isValidCatalogId(String catalogId) {
        if (catalogId == null || catalogId.isBlank()) return false;
        if (catalogId.equals(".") || catalogId.contains("..")) return false;
        return CATALOG_ID.matcher(catalogId).matches();
    }
}
