package dev.openresearch.mcp.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.openresearch.backend.BackendSession;
import dev.openresearch.backend.ReactorBackendConnectionFactory;
import dev.openresearch.backend.ResearchBackendClient;

/**
 * Wires the backend session and client. The session connects when the context starts, so an
 * unusable backend configuration aborts startup, and it is closed with the context.
 */
@Configuration
@EnableConfigurationProperties({ BackendProperties.class, ResearchServerProperties.class })
public class BackendConfig {

	private static final Logger logger = LoggerFactory.getLogger(BackendConfig.class);

	@Bean(initMethod = "start", destroyMethod = "close")
	public BackendSession backendSession(BackendProperties backendProperties,
			ResearchServerProperties serverProperties, ObjectMapper objectMapper) {
		logger.info("Using research backend {} (timeout {})", backendProperties.getUrl(),
				backendProperties.getTimeout());
		return new BackendSession(backendProperties.toSettings(serverProperties.userAgent()),
				new ReactorBackendConnectionFactory(), objectMapper);
	}

	@Bean
	public ResearchBackendClient researchBackendClient(BackendSession backendSession) {
		return new ResearchBackendClient(backendSession);
	}

}
