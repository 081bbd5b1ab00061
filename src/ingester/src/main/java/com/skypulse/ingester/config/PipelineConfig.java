package com.skypulse.ingester.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skypulse.analytics.classify.AircraftTypeLookup;
import com.skypulse.analytics.classify.WeightClassifier;
import com.skypulse.analytics.engine.AnalyticsEngine;
import com.skypulse.analytics.engine.AnalyticsSettings;
import com.skypulse.analytics.export.FlightCsvWriter;
import com.skypulse.analytics.transform.FlightTransformer;
import com.skypulse.analytics.transform.StateVectorParser;
import com.skypulse.analytics.transform.TransformPipeline;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the pure transform and analytics stages from {@link PipelineProperties}. */
@Configuration
public class PipelineConfig {

  @Bean
  public WeightClassifier weightClassifier(
      PipelineProperties properties, ObjectProvider<AircraftTypeLookup> typeLookup) {
    PipelineProperties.Classification classification = properties.getClassification();
    return new WeightClassifier(
        classification.getCategories().isEmpty()
            ? WeightClassifier.defaultCategoryClasses()
            : classification.getCategories(),
        classification.getTypecodePrefixes().isEmpty()
            ? WeightClassifier.defaultTypecodePrefixes()
            : classification.getTypecodePrefixes(),
        typeLookup.getIfAvailable(AircraftTypeLookup::none));
  }

  @Bean
  public TransformPipeline transformPipeline(
      ObjectMapper objectMapper, WeightClassifier weightClassifier, PipelineProperties properties) {
    try {
      return new TransformPipeline(
          new StateVectorParser(objectMapper),
          new FlightTransformer(weightClassifier, properties.getClimbThresholdMps()));
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("Invalid pipeline.climb-threshold-mps: " + ex.getMessage(), ex);
    }
  }

  @Bean
  public AnalyticsEngine analyticsEngine(PipelineProperties properties) {
    PipelineProperties.Anomaly anomaly = properties.getAnomaly();
    try {
      return new AnalyticsEngine(new AnalyticsSettings(
          anomaly.getStdDevThreshold(),
          anomaly.getMinSamples(),
          anomaly.getMaxSpeedMps(),
          anomaly.isLowAltitudeRuleEnabled(),
          anomaly.getLowAltitudeThresholdM(),
          properties.getCompassSectors()));
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("Invalid pipeline analytics settings: " + ex.getMessage(), ex);
    }
  }

  @Bean
  public FlightCsvWriter flightCsvWriter() {
    return new FlightCsvWriter();
  }
}
