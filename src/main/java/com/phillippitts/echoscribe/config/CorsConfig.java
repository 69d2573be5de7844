package com.phillippitts.echoscribe.config;

import com.phillippitts.echoscribe.config.settings.AiServiceSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Cross-origin access for the browser frontends listed in {@code ai.server.cors-origins}.
 *
 * <p>Origins are registered as patterns so that {@code *} stays usable together with
 * credentials. An empty list disables cross-origin access.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private static final Logger LOG = LogManager.getLogger(CorsConfig.class);

    static final String[] ALLOWED_METHODS = {"GET", "POST", "PUT", "DELETE", "OPTIONS"};
    static final String[] ALLOWED_HEADERS = {"Content-Type", "Authorization", "X-Requested-With",
            "X-Request-ID", "X-User-ID", "X-Meeting-ID"};
    static final String[] EXPOSED_HEADERS = {"X-Request-ID"};

    private final AiServiceSettings settings;

    public CorsConfig(AiServiceSettings settings) {
        this.settings = settings;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        List<String> origins = settings.server().corsOrigins();
        if (origins == null || origins.isEmpty()) {
            LOG.info("No CORS origins configured; cross-origin requests will be rejected");
            return;
        }
        LOG.info("Allowing cross-origin requests from {}", origins);
        registry.addMapping("/**")
                .allowedOriginPatterns(origins.stream().map(String::strip).toArray(String[]::new))
                .allowedMethods(ALLOWED_METHODS)
                .allowedHeaders(ALLOWED_HEADERS)
                .exposedHeaders(EXPOSED_HEADERS)
                .allowCredentials(true);
    }
}
