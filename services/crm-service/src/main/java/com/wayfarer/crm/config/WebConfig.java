package com.wayfarer.crm.config;

import com.wayfarer.crm.infrastructure.web.AccessGateInterceptor;
import com.wayfarer.crm.infrastructure.web.PrincipalArgumentResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS, the access-gate interceptor and principal injection.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AccessGateInterceptor accessGateInterceptor;

    public WebConfig(AccessGateInterceptor accessGateInterceptor) {
        this.accessGateInterceptor = accessGateInterceptor;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // Local frontends only; production origins come from the gateway.
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(accessGateInterceptor).addPathPatterns("/api/**");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new PrincipalArgumentResolver());
    }
}
