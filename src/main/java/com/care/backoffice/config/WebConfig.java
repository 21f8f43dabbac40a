package com.care.backoffice.config;

import com.care.backoffice.auth.AdminSessionInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AdminSessionInterceptor adminSessionInterceptor;
    private final BackofficeProperties properties;

    public WebConfig(AdminSessionInterceptor adminSessionInterceptor, BackofficeProperties properties) {
        this.adminSessionInterceptor = adminSessionInterceptor;
        this.properties = properties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(adminSessionInterceptor)
                .addPathPatterns("/api/**", "/admin/**")
                .excludePathPatterns(
                        "/api/auth/login",
                        "/api/public/**",
                        "/api/patient-auth/**"
                );
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        BackofficeProperties.Storage storage = properties.storage();
        if ("local".equalsIgnoreCase(storage.backend())) {
            String location = Path.of(storage.localDirectory()).toAbsolutePath().toUri().toString();
            registry.addResourceHandler(storage.publicPath() + "/**")
                    .addResourceLocations(location.endsWith("/") ? location : location + "/");
        }
    }
}
