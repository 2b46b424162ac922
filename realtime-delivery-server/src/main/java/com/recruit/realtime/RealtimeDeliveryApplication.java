package com.recruit.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RealtimeDeliveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealtimeDeliveryApplication.class, args);
    }
}
