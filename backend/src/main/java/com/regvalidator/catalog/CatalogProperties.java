package com.regvalidator.catalog;

import com.regvalidator.api.validation.CatalogId;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where catalogs live and how long parsed catalogs stay cached.
 */
@ConfigurationProperties(prefix = "regvalidator.catalog")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class CatalogProperties {

    /** Directory holding {@code <catalogId>.json} files. */
    private String directory = "catalogs";

    /** Catalog used when a request does not name one. */
    @CatalogId
    private String defaultCatalog = "course_data";

    private long cacheTtlMinutes = 60;

    private long cacheMaxSize = 50;
}
