package com.gocomet.ridepool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RidePoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(RidePoolApplication.class, args);
    }
}
