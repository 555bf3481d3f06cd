package com.localguide.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.localguide.model.cultural.CulturalCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * 문화 정보 카탈로그 로드 (기동 시 1회, 이후 읽기 전용)
 */
@Configuration
public class CulturalCatalogConfig {

    private static final Logger logger = LoggerFactory.getLogger(CulturalCatalogConfig.class);

    @Bean
    public CulturalCatalog culturalCatalog(ResourceLoader resourceLoader, ObjectMapper objectMapper,
                                           GuideProperties properties) {
        String location = properties.getCultural().getCatalogLocation();
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            CulturalCatalog catalog = CulturalCatalog.read(in, objectMapper);
            logger.info("[CulturalCatalogConfig] loaded - location: {}, regions: {}, festivals: {}, etiquetteContexts: {}, bargainingContexts: {}",
                location, catalog.getRegions().size(), catalog.getFestivals().size(),
                catalog.getEtiquette().size(), catalog.getBargainingTips().size());
            return catalog;
        } catch (IOException e) {
            logger.error("[CulturalCatalogConfig] failed to load cultural catalog - location: {}", location, e);
            throw new IllegalStateException("Cannot load cultural catalog from " + location, e);
        }
    }
}
