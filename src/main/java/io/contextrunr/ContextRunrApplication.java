package io.contextrunr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ContextRunr: context retrieval and cross-reference resolution for a multi-chat agent.
 */
@SpringBootApplication
public class ContextRunrApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextRunrApplication.class, args);
    }
}
