package com.decoadmin.backend.modules.storage.infrastructure;

import java.nio.file.Path;

import com.decoadmin.backend.global.config.StorageProperties;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves locally stored blobs at {@code /files/**}.
 */
@Configuration
public class StorageWebConfig implements WebMvcConfigurer {

    public static final String FILES_PATH_PATTERN = "/files/**";

    private final StorageProperties properties;

    public StorageWebConfig(StorageProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = Path.of(properties.local().root()).toAbsolutePath().normalize().toUri().toString();
        registry.addResourceHandler(FILES_PATH_PATTERN)
                .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
