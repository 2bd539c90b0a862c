package com.climateforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClimateForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClimateForecastApplication.class, args);
    }
}
