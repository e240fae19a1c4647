package com.kspec.config;

import com.kspec.auth.LocalhostOnlyFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final DaemonProperties daemonProperties;

    public WebConfig(DaemonProperties daemonProperties) {
        this.daemonProperties = daemonProperties;
    }

    @Bean
    public FilterRegistrationBean<LocalhostOnlyFilter> localhostOnlyFilterRegistration(
            LocalhostOnlyFilter localhostOnlyFilter) {
        FilterRegistrationBean<LocalhostOnlyFilter> registration = new FilterRegistrationBean<>(localhostOnlyFilter);
        registration.addUrlPatterns("/api/*", daemonProperties.getWebsocket().getPath());
        registration.setOrder(1);
        return registration;
    }
}
