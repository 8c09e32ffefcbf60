package com.aiinpocket.gmtracker;

import com.aiinpocket.gmtracker.config.GamificationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(GamificationProperties.class)
public class GmTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GmTrackerApplication.class, args);
    }

}
