package com.audiencemanager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AudienceManagerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AudienceManagerApplication.class, args);
    }
}
