package com.moddock.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Moddock moderation API.
 *
 * Reports against projects, versions and users, their discussion threads,
 * and the personal access tokens used to call the API.
 */
@SpringBootApplication(scanBasePackages = "com.moddock")
@EntityScan(basePackages = "com.moddock.core.domain")
@EnableJpaRepositories(basePackages = "com.moddock.core.repository")
public class ModdockApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModdockApiApplication.class, args);
    }
}
