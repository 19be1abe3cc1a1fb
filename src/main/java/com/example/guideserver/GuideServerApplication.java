package com.example.guideserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GuideServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuideServerApplication.class, args);
    }

}
