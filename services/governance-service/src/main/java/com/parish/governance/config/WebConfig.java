package com.parish.governance.config;

import com.parish.governance.infrastructure.web.AuthenticationInterceptor;
import com.parish.governance.infrastructure.web.SecurityContextArgumentResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS, the authentication interceptor on {@code /api/**} and the
 * {@code SecurityContext} handler argument.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AuthenticationInterceptor authenticationInterceptor;
    private final GovernanceProperties properties;

    public WebConfig(AuthenticationInterceptor authenticationInterceptor, GovernanceProperties properties) {
        this.authenticationInterceptor = authenticationInterceptor;
        this.properties = properties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(authenticationInterceptor).addPathPatterns("/api/**");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new SecurityContextArgumentResolver());
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = properties.corsOrigins().toArray(String[]::new);
        for (String pattern : List.of("/api/**", "/auth/**")) {
            registry.addMapping(pattern)
                    .allowedOrigins(origins)
                    .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                    .allowedHeaders("*")
                    .exposedHeaders("X-Correlation-ID", "X-Request-ID")
                    .allowCredentials(true)
                    .maxAge(3600);
        }
    }
}
