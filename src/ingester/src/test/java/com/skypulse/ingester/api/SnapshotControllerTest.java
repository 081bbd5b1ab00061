package com.skypulse.ingester.api;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.skypulse.analytics.engine.AnalyticsEngine;
import com.skypulse.analytics.engine.AnalyticsSettings;
import com.skypulse.analytics.export.FlightCsvWriter;
import com.skypulse.analytics.model.FlightPhase;
import com.skypulse.analytics.model.FlightRecord;
import com.skypulse.analytics.model.GeoPosition;
import com.skypulse.analytics.model.Snapshot;
import com.skypulse.analytics.model.WeightClass;
import com.skypulse.ingester.budget.BudgetState;
import com.skypulse.ingester.budget.CreditBudgetTracker;
import com.skypulse.ingester.region.BoundingBox;
import com.skypulse.ingester.region.Region;
import com.skypulse.ingester.region.RegionCatalog;
import com.skypulse.ingester.schedule.RegionFetchScheduler;
import com.skypulse.ingester.snapshot.SnapshotStore;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(
    controllers = SnapshotController.class,
    properties = "ingester.scheduling.enabled=false")
@AutoConfigureMockMvc(addFilters = false)
@Import(FlightCsvWriter.class)
class SnapshotControllerTest {
  private static final Instant CAPTURED_AT = Instant.parse("2024-05-01T10:00:00Z");
  private static final Region EUROPE = new Region("europe", new BoundingBox(36.0, 71.0, -10.0, 40.0));

  @Autowired private MockMvc mockMvc;

  @MockBean private RegionCatalog catalog;
  @MockBean private SnapshotStore snapshotStore;
  @MockBean private RegionFetchScheduler scheduler;
  @MockBean private CreditBudgetTracker budget;
  @MockBean private SnapshotStreamService streamService;

  @BeforeEach
  void setUp() {
    when(catalog.ordered()).thenReturn(List.of(EUROPE));
    when(catalog.find("europe")).thenReturn(Optional.of(EUROPE));
    when(budget.state()).thenReturn(new BudgetState(120, 3880, 4000, 24, 3.0));
  }

  private static Snapshot snapshot() {
    FlightRecord record = new FlightRecord(
        "3c6444", "DLH9LF", "Germany",
        Optional.of(new GeoPosition(50.03, 8.57)),
        OptionalDouble.of(10_500.0),
        OptionalDouble.of(230.0),
        OptionalDouble.of(270.0),
        OptionalDouble.of(0.0),
        WeightClass.LARGE,
        FlightPhase.LEVEL,
        Set.of());
    FlightRecord other = new FlightRecord(
        "4ca7b5", "RYR12", "Ireland",
        Optional.of(new GeoPosition(53.42, -6.27)),
        OptionalDouble.of(3_000.0),
        OptionalDouble.of(150.0),
        OptionalDouble.of(90.0),
        OptionalDouble.of(8.0),
        WeightClass.SMALL,
        FlightPhase.CLIMBING,
        Set.of());
    List<FlightRecord> records = List.of(record, other);
    return Snapshot.of("europe", CAPTURED_AT, records,
        new AnalyticsEngine(AnalyticsSettings.defaults()).analyze(records));
  }

  @Test
  void regions_listsRegionsWithBudget() throws Exception {
    when(snapshotStore.current("europe")).thenReturn(Optional.of(snapshot()));

    mockMvc.perform(get("/api/regions"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.regions[0].name").value("europe"))
        .andExpect(jsonPath("$.regions[0].estimated_credit_cost").value(4))
        .andExpect(jsonPath("$.budget.remaining").value(3880));
  }

  @Test
  void snapshot_returnsLatestSnapshot() throws Exception {
    when(snapshotStore.current("europe")).thenReturn(Optional.of(snapshot()));

    mockMvc.perform(get("/api/regions/europe/snapshot"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.region").value("europe"))
        .andExpect(jsonPath("$.records[0].icao24").value("3c6444"))
        .andExpect(jsonPath("$.records.length()").value(2))
        .andExpect(jsonPath("$.aggregates.total_count").value(2));
  }

  @Test
  void snapshot_unknownRegionReturns404() throws Exception {
    when(catalog.find("mars")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/regions/mars/snapshot"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_found"));
  }

  @Test
  void snapshot_beforeFirstFetchReturnsNotYetAvailable() throws Exception {
    when(snapshotStore.current("europe")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/regions/europe/snapshot"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_yet_available"));
  }

  @Test
  void analytics_returnsAggregatesOnly() throws Exception {
    when(snapshotStore.current("europe")).thenReturn(Optional.of(snapshot()));

    mockMvc.perform(get("/api/regions/europe/analytics"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.region").value("europe"))
        .andExpect(jsonPath("$.aggregates.total_count").value(2))
        .andExpect(jsonPath("$.aggregates.anomaly_count").value(0))
        .andExpect(jsonPath("$.records").doesNotExist());
  }

  @Test
  void flightsCsv_returnsCsvBody() throws Exception {
    when(snapshotStore.current("europe")).thenReturn(Optional.of(snapshot()));

    mockMvc.perform(get("/api/regions/europe/flights.csv"))
        .andExpect(status().isOk())
        .andExpect(header().string("Content-Type", startsWith("text/csv")))
        .andExpect(header().string("Content-Disposition", "inline; filename=\"europe-flights.csv\""))
        .andExpect(content().string(startsWith(String.join(",", FlightCsvWriter.COLUMNS) + "\n3c6444,")));
  }

  @Test
  void snapshot_searchMatchesCallsignOrIcao24() throws Exception {
    when(snapshotStore.current("europe")).thenReturn(Optional.of(snapshot()));

    mockMvc.perform(get("/api/regions/europe/snapshot").param("q", "ryr"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.records.length()").value(1))
        .andExpect(jsonPath("$.records[0].icao24").value("4ca7b5"))
        .andExpect(jsonPath("$.aggregates.total_count").value(2));

    mockMvc.perform(get("/api/regions/europe/snapshot").param("q", "3C64"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.records.length()").value(1))
        .andExpect(jsonPath("$.records[0].callsign").value("DLH9LF"));
  }

  @Test
  void snapshot_filtersByWeightClassAndCountry() throws Exception {
    when(snapshotStore.current("europe")).thenReturn(Optional.of(snapshot()));

    mockMvc.perform(get("/api/regions/europe/snapshot").param("weight_class", "large"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.records.length()").value(1))
        .andExpect(jsonPath("$.records[0].icao24").value("3c6444"));

    mockMvc.perform(get("/api/regions/europe/snapshot")
            .param("weight_class", "large")
            .param("country", "ireland"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.records.length()").value(0));
  }

  @Test
  void snapshot_unknownWeightClassReturns400() throws Exception {
    mockMvc.perform(get("/api/regions/europe/snapshot").param("weight_class", "jumbo"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("bad_request"));
  }

  @Test
  void flightsCsv_appliesFilters() throws Exception {
    when(snapshotStore.current("europe")).thenReturn(Optional.of(snapshot()));

    mockMvc.perform(get("/api/regions/europe/flights.csv").param("country", "Ireland"))
        .andExpect(status().isOk())
        .andExpect(content().string(startsWith(String.join(",", FlightCsvWriter.COLUMNS) + "\n4ca7b5,")))
        .andExpect(content().string(not(containsString("3c6444"))));
  }

  @Test
  void budget_returnsState() throws Exception {
    mockMvc.perform(get("/api/budget"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.consumed").value(120))
        .andExpect(jsonPath("$.limit").value(4000))
        .andExpect(jsonPath("$.window_hours").value(24));
  }
}
