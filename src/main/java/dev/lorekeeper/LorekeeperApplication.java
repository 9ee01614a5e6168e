package dev.lorekeeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Profiles;

/**
 * Entry point for the Lorekeeper document question-answering service.
 *
 * <p>Runs as a web service by default. The {@code backfill} profile runs a one-shot embedding
 * backfill pass instead (no web server) and exits with its status.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LorekeeperApplication {
  public static void main(String[] args) {
    ConfigurableApplicationContext context =
        SpringApplication.run(LorekeeperApplication.class, args);
    if (context.getEnvironment().acceptsProfiles(Profiles.of("backfill"))) {
      System.exit(SpringApplication.exit(context));
    }
  }
}
