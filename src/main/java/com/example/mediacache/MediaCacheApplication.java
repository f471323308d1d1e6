package com.example.mediacache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MediaCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaCacheApplication.class, args);
    }
}
