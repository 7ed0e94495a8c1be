package com.strata.hierarchy.config;

import com.strata.hierarchy.infrastructure.security.IdentityContextArgumentResolver;
import com.strata.hierarchy.infrastructure.web.ListQueryArgumentResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** CORS for browser clients and the controller argument resolvers. */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final HierarchyServiceProperties properties;
    private final IdentityContextArgumentResolver identityResolver;
    private final ListQueryArgumentResolver listQueryResolver;

    public WebConfig(
            HierarchyServiceProperties properties,
            IdentityContextArgumentResolver identityResolver,
            ListQueryArgumentResolver listQueryResolver) {
        this.properties = properties;
        this.identityResolver = identityResolver;
        this.listQueryResolver = listQueryResolver;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (properties.corsAllowedOrigins().isEmpty()) {
            return;
        }
        registry.addMapping("/api/**")
                .allowedOrigins(properties.corsAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PATCH", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("X-Correlation-ID")
                .maxAge(3600);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(identityResolver);
        resolvers.add(listQueryResolver);
    }
}
