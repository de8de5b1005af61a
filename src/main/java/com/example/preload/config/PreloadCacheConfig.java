package com.example.preload.config;

import com.example.preload.backend.TaskDetail;
import com.example.preload.core.PreloadCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PreloadCacheProperties.class)
public class PreloadCacheConfig {

    private static final Logger log = LoggerFactory.getLogger(PreloadCacheConfig.class);

    @Bean(destroyMethod = "close")
    public PreloadCache<String, TaskDetail> taskDetailCache(PreloadCacheProperties properties) {
        log.info("Creating task detail preload cache: {}", properties);
        return new PreloadCache<>(properties.toSettings());
    }
}
