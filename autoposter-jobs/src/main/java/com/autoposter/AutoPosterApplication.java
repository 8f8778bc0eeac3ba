package com.autoposter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AutoPosterApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoPosterApplication.class, args);
    }

}
