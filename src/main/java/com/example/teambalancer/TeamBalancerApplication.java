package com.example.teambalancer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TeamBalancerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TeamBalancerApplication.class, args);
    }
}
