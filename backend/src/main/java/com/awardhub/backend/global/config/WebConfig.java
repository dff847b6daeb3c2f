package com.awardhub.backend.global.config;

import java.nio.file.Path;

import com.awardhub.backend.global.storage.LocalFileStorage;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves permanent uploads (reward images, application documents) under {@code /media/**}.
 * Staged wizard uploads live outside the media directory and are never served.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final String storageRoot;

    public WebConfig(@Value("${awardhub.storage.root}") String storageRoot) {
        this.storageRoot = storageRoot;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = Path.of(storageRoot, LocalFileStorage.MEDIA_DIR).toAbsolutePath().normalize().toUri().toString();
        registry.addResourceHandler("/media/**")
                .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
