package com.regvalidator.catalog;

import com.regvalidator.config.CaffeineConfig;
import com.regvalidator.domain.CourseCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolves catalog ids to {@code <directory>/<catalogId>.json} and caches parsed catalogs.
 * Load failures are not cached; the next request retries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogRegistry {

    private final CatalogLoader catalogLoader;
    private final CatalogProperties properties;

    @Cacheable(cacheNames = CaffeineConfig.CATALOG_CACHE, key = "#catalogId")
    public CourseCatalog load(String catalogId) {
        Path file = resolve(catalogId);
        if (!Files.isRegularFile(file)) {
            throw new CatalogLoadException(CatalogLoadException.CATALOG_NOT_FOUND, "Unknown catalog: " + catalogId);
        }
        log.info("Loading catalog {} from {}", catalogId, file);
        return catalogLoader.load(file);
    }

    public String defaultCatalogId() {
        return properties.getDefaultCatalog();
    }

    Path resolve(String catalogId) {
        return Path.of(properties.getDirectory()).resolve(catalogId + ".json").normalize();
    }
}
