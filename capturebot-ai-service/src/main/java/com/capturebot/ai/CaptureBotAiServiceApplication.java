package com.capturebot.ai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication
@ComponentScan(basePackages = {
        "com.capturebot.ai",
        "com.capturebot.common"
})
@EntityScan(basePackages = "com.capturebot.common.entity")
@EnableJpaRepositories(basePackages = "com.capturebot.common.repository")
public class CaptureBotAiServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaptureBotAiServiceApplication.class, args);
    }

}
