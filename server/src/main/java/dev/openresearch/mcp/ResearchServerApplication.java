package dev.openresearch.mcp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the OpenResearch MCP server.
 */
@SpringBootApplication
public class ResearchServerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ResearchServerApplication.class, args);
	}

}
