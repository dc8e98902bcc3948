package com.regvalidator.validation.config;

import com.regvalidator.batch.BatchProperties;
import com.regvalidator.catalog.CatalogProperties;
import com.regvalidator.validation.engine.CreditLimits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the application's property classes and exposes the credit limits as a bean.
 */
@Configuration
@EnableConfigurationProperties({ValidationProperties.class, CatalogProperties.class, BatchProperties.class})
@Slf4j
public class ValidationConfig {

    @Bean
    public CreditLimits creditLimits(ValidationProperties properties) {
        CreditLimits limits = properties.toCreditLimits();
        log.info("Credit limits: regular={} summer={}", limits.regularSemesterLimit(), limits.summerLimit());
        return limits;
    }
}
