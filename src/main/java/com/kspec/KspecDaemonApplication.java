package com.kspec;

import com.kspec.config.DaemonProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties(DaemonProperties.class)
public class KspecDaemonApplication {

    public static void main(String[] args) {
        SpringApplication.run(KspecDaemonApplication.class, args);
    }
}
