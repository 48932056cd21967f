package com.promptoptimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Prompt Optimizer - token-reducing prompt rewriting service.
 */
@SpringBootApplication
public class PromptOptimizerApplication {

	public static void main(String[] args) {
		SpringApplication.run(PromptOptimizerApplication.class, args);
	}

}
