package com.skypulse.ingester.aircraft;

import com.skypulse.ingester.config.ConfigurationException;
import com.skypulse.ingester.config.PipelineProperties;
import java.nio.file.Path;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Optional aircraft reference DB. When enabled, the weight classifier falls back to ICAO type
 * codes for state vectors without a category.
 */
@Configuration
public class AircraftDbConfig {

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "pipeline.aircraft-db", name = "enabled", havingValue = "true")
  public SqliteAircraftTypeLookup aircraftTypeLookup(PipelineProperties properties) {
    String path = properties.getAircraftDb().getPath();
    if (path == null || path.isBlank()) {
      throw new ConfigurationException("pipeline.aircraft-db.enabled=true but pipeline.aircraft-db.path is empty");
    }
    return new SqliteAircraftTypeLookup(Path.of(path), properties.getAircraftDb().getCacheSize());
  }
}
