package com.flightphotos.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class FlightPhotoScraperApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlightPhotoScraperApplication.class, args);
    }
}
