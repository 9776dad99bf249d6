package com.pibridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Query bridge between chat triggers and AVEVA PI historian tags.
 */
@SpringBootApplication
public class PiBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PiBridgeApplication.class, args);
    }
}
