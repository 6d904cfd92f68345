package org.jstats.fantasyhub_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
public class FantasyHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(FantasyHubApplication.class, args);
    }
}
