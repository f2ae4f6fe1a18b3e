package com.llmdispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the LLM dispatch layer.
 */
@SpringBootApplication
public class LlmDispatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(LlmDispatchApplication.class, args);
    }
}
