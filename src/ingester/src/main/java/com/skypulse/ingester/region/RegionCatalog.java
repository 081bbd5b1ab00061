package com.skypulse.ingester.region;

import com.skypulse.ingester.config.ConfigurationException;
import com.skypulse.ingester.config.IngesterProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Ordered, validated set of regions to poll.
 *
 * <p>Iteration order is the configured order; the scheduler authorizes regions in that order so
 * that earlier regions win when the budget runs low.
 */
@Component
public class RegionCatalog {
  private static final Logger log = LoggerFactory.getLogger(RegionCatalog.class);

  static final List<Region> DEFAULT_REGIONS = List.of(
      new Region("north_america", new BoundingBox(24.0, 71.0, -170.0, -50.0)),
      new Region("europe", new BoundingBox(36.0, 71.0, -10.0, 40.0)),
      new Region("asia", new BoundingBox(-10.0, 55.0, 60.0, 150.0)));

  private final Map<String, Region> regions;

  @Autowired
  public RegionCatalog(IngesterProperties properties) {
    this(toRegions(properties.regions()));
  }

  public RegionCatalog(List<Region> configured) {
    List<Region> source = configured.isEmpty() ? DEFAULT_REGIONS : configured;
    Map<String, Region> byName = new LinkedHashMap<>();
    for (Region configuredRegion : source) {
      Region region = normalize(configuredRegion);
      validate(region);
      if (byName.putIfAbsent(region.name(), region) != null) {
        throw new ConfigurationException("Duplicate region name: " + region.name());
      }
    }
    this.regions = Collections.unmodifiableMap(byName);
    regions.values().forEach(region -> log.info(
        "Region configured: name={}, bbox={}, areaDeg2={}, creditCost={}",
        region.name(),
        region.boundingBox(),
        String.format(Locale.ROOT, "%.1f", region.boundingBox().areaDeg2()),
        region.estimatedCreditCost()));
  }

  public List<Region> ordered() {
    return List.copyOf(regions.values());
  }

  public Optional<Region> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(regions.get(name.trim().toLowerCase(Locale.ROOT)));
  }

  public int size() {
    return regions.size();
  }

  private static List<Region> toRegions(List<IngesterProperties.RegionConfig> configs) {
    if (configs == null) {
      return List.of();
    }
    List<Region> result = new ArrayList<>(configs.size());
    for (IngesterProperties.RegionConfig config : configs) {
      if (config == null) {
        throw new ConfigurationException("Region name is required");
      }
      result.add(new Region(
          config.name(),
          new BoundingBox(config.latMin(), config.latMax(), config.lonMin(), config.lonMax())));
    }
    return result;
  }

  private static Region normalize(Region region) {
    if (region.name() == null || region.name().isBlank()) {
      throw new ConfigurationException("Region name is required");
    }
    String name = region.name().trim().toLowerCase(Locale.ROOT);
    return name.equals(region.name()) ? region : new Region(name, region.boundingBox());
  }

  private static void validate(Region region) {
    if (!region.boundingBox().isValid()) {
      throw new ConfigurationException(
          "Invalid bounding box for region " + region.name() + ": " + region.boundingBox()
              + " (lat within [-90,90], lon within [-180,180], min < max)");
    }
  }
}
