package com.skypulse.ingester.region;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.skypulse.ingester.config.ConfigurationException;
import com.skypulse.ingester.config.IngesterProperties;
import java.util.List;
import org.junit.jupiter.api.Test;

class RegionCatalogTest {

  private static IngesterProperties withRegions(List<IngesterProperties.RegionConfig> regions) {
    return new IngesterProperties(60_000L, 0L, 2, null, regions, null, null);
  }

  @Test
  void keepsConfiguredOrderAndNormalizesNames() {
    RegionCatalog catalog = new RegionCatalog(withRegions(List.of(
        new IngesterProperties.RegionConfig("Europe", 36.0, 71.0, -10.0, 40.0),
        new IngesterProperties.RegionConfig("paris", 48.0, 49.5, 1.5, 3.5))));

    assertThat(catalog.ordered()).extracting(Region::name).containsExactly("europe", "paris");
    assertThat(catalog.find(" EUROPE ")).map(Region::name).contains("europe");
    assertThat(catalog.find("mars")).isEmpty();
  }

  @Test
  void fallsBackToDefaultRegions() {
    RegionCatalog catalog = new RegionCatalog(withRegions(List.of()));

    assertThat(catalog.ordered()).extracting(Region::name)
        .containsExactly("north_america", "europe", "asia");
  }

  @Test
  void rejectsDuplicateNames() {
    assertThatThrownBy(() -> new RegionCatalog(withRegions(List.of(
        new IngesterProperties.RegionConfig("europe", 36.0, 71.0, -10.0, 40.0),
        new IngesterProperties.RegionConfig("EUROPE", 40.0, 50.0, 0.0, 10.0)))))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("Duplicate");
  }

  @Test
  void rejectsInvalidBoundingBox() {
    assertThatThrownBy(() -> new RegionCatalog(withRegions(List.of(
        new IngesterProperties.RegionConfig("upside_down", 50.0, 40.0, 0.0, 10.0)))))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> new RegionCatalog(withRegions(List.of(
        new IngesterProperties.RegionConfig("beyond", 0.0, 95.0, 0.0, 10.0)))))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void creditCostFollowsAreaTiers() {
    assertThat(new BoundingBox(0.0, 5.0, 0.0, 5.0).creditCost()).isEqualTo(1);
    assertThat(new BoundingBox(0.0, 10.0, 0.0, 10.0).creditCost()).isEqualTo(2);
    assertThat(new BoundingBox(0.0, 20.0, 0.0, 20.0).creditCost()).isEqualTo(3);
    assertThat(new BoundingBox(36.0, 71.0, -10.0, 40.0).creditCost()).isEqualTo(4);
  }

  @Test
  void normalizesNamesOfDirectlyBuiltRegions() {
    RegionCatalog catalog = new RegionCatalog(List.of(
        new Region(" Europe ", new BoundingBox(36.0, 71.0, -10.0, 40.0))));

    assertThat(catalog.find("europe")).map(Region::name).contains("europe");
    assertThat(catalog.find("EUROPE")).isPresent();
    assertThat(catalog.ordered()).extracting(Region::name).containsExactly("europe");
  }

  @Test
  void rejectsBlankRegionName() {
    assertThatThrownBy(() -> new RegionCatalog(List.of(
        new Region("  ", new BoundingBox(36.0, 71.0, -10.0, 40.0)))))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("name is required");
  }
}
