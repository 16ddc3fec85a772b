package com.shopsense.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.shopsense")
@EntityScan(basePackages = "com.shopsense")
@EnableJpaRepositories(basePackages = "com.shopsense")
@EnableScheduling
@EnableAsync
public class ShopSenseApplication {
    public static void main(String[] args) {
        SpringApplication.run(ShopSenseApplication.class, args);
    }
}
