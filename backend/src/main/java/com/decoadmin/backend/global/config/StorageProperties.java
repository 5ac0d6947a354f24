package com.decoadmin.backend.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "storage")
public record StorageProperties(
        @DefaultValue Local local,
        @DefaultValue("http://localhost:8080/files") String publicBaseUrl
) {

    public record Local(@DefaultValue("./data/blobs") String root) {
    }
}
