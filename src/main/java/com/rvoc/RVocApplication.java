package com.rvoc;

import com.rvoc.config.RVocProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(RVocProperties.class)
public class RVocApplication {

    public static void main(String[] args) {
        SpringApplication.run(RVocApplication.class, args);
    }
}
