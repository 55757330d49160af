package com.geochat.routing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoutingApiApplication {
    public static void main(String[] args) {
        SpringApplication.run(RoutingApiApplication.class, args);
    }
}
