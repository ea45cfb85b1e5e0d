package com.example.catalog_import.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({ImportProperties.class, MetadataProperties.class})
public class AppPropertiesConfig {
}
