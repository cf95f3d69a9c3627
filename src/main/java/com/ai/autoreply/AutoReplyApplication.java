package com.ai.autoreply;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.ai.autoreply")
@EnableJpaRepositories(basePackages = "com.ai.autoreply.repository")
@EntityScan(basePackages = "com.ai.autoreply.entity")
@EnableScheduling
public class AutoReplyApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoReplyApplication.class, args);
    }
}
