package com.cfo.forecastengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ForecastEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastEngineApplication.class, args);
    }
}
