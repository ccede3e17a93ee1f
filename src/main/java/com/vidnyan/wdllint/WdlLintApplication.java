package com.vidnyan.wdllint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * WDL lint engine.
 * <p>
 * Annotates type-checked WDL documents with hygiene warnings.
 */
@SpringBootApplication
public class WdlLintApplication {

    public static void main(String[] args) {
        SpringApplication.run(WdlLintApplication.class, args);
    }
}
