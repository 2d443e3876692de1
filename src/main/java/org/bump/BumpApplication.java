package org.bump;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BumpApplication {
    public static void main(String[] args) {
        SpringApplication.run(BumpApplication.class, args);
    }
}
