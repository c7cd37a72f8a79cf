package com.example.litestream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LitestreamReplicaApplication {

    public static void main(String[] args) {
        SpringApplication.run(LitestreamReplicaApplication.class, args);
    }
}
