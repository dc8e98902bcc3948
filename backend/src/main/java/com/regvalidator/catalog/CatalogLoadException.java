package com.regvalidator.catalog;

import lombok.Getter;

/**
 * Catalog could not be produced. Fatal for every transcript that depends on the catalog; callers must not
 * fall back to an empty catalog.
 */
@Getter
public class CatalogLoadException extends RuntimeException {

    public static final String CATALOG_NOT_FOUND = "CATALOG_NOT_FOUND";
    public static final String CATALOG_UNREADABLE = "CATALOG_UNREADABLE";
    public static final String CATALOG_INVALID = "CATALOG_INVALID";

    /** CATALOG_NOT_FOUND, CATALOG_UNREADABLE or CATALOG_INVALID. */
    private final String errorCode;

    public CatalogLoadException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CatalogLoadException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
