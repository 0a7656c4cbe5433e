package com.atlas.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration for Detection Atlas.
 *
 * Export responses are streamed from a dedicated executor so a large export
 * does not hold a servlet container thread. The async timeout bounds how long
 * a single export may run.
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebMvcConfig.class);

    private final long exportTimeoutMs;
    private final int exportThreads;

    public WebMvcConfig(
            @Value("${atlas.export.timeout-ms:300000}") long exportTimeoutMs,
            @Value("${atlas.export.threads:4}") int exportThreads) {
        this.exportTimeoutMs = exportTimeoutMs;
        this.exportThreads = exportThreads;
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(exportThreads);
        executor.setMaxPoolSize(exportThreads);
        executor.setThreadNamePrefix("atlas-export-");
        executor.initialize();

        configurer.setTaskExecutor(executor);
        configurer.setDefaultTimeout(exportTimeoutMs);
        log.info("Export streaming configured with {} threads and {}ms timeout", exportThreads, exportTimeoutMs);
    }
}
