package com.ciro.gatemux.spring;

import com.ciro.gatemux.spi.AccessPolicy;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class GatemuxWebMvcConfig implements WebMvcConfigurer {

    private final AccessPolicy access;

    public GatemuxWebMvcConfig(AccessPolicy access) {
        this.access = access;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AccessInterceptor(access)).addPathPatterns("/api/**");
    }
}
