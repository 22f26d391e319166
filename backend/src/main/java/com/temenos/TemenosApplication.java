package com.temenos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TemenosApplication {

    public static void main(String[] args) {
        SpringApplication.run(TemenosApplication.class, args);
    }
}
