package com.care.backoffice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.care.backoffice")
@EnableJpaRepositories(basePackages = "com.care.backoffice.repository")
@EntityScan(basePackages = "com.care.backoffice.entity")
@ConfigurationPropertiesScan(basePackages = "com.care.backoffice.config")
public class BackofficeApplication {

    public static void main(String[] args) {
        SpringApplication.run(BackofficeApplication.class, args);
    }
}
