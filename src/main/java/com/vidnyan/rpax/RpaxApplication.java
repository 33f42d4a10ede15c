package com.vidnyan.rpax;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * rpax - workflow parser and call graph builder for RPA projects.
 */
@SpringBootApplication
public class RpaxApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(RpaxApplication.class, args)));
    }
}
