package dev.candor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Candor interview-evaluation engine.
 *
 * <p>Exposes the engine over REST ({@code /api/**}) and as MCP tools over the SSE transport.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CandorApplication {

  public static void main(String[] args) {
    SpringApplication.run(CandorApplication.class, args);
  }
}
