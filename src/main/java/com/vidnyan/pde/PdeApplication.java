package com.vidnyan.pde;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PDE - Pattern Detection Engine
 *
 * Finds design idioms in parsed program trees and rewrites them with templates.
 */
@SpringBootApplication
public class PdeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdeApplication.class, args);
    }
}
