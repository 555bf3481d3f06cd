package com.localguide;

import com.localguide.config.GuideProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableAsync
@EnableConfigurationProperties(GuideProperties.class)
public class LocalGuideApplication {
    public static void main(String[] args) {
        SpringApplication.run(LocalGuideApplication.class, args);
    }
}
