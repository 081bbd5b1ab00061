package com.skypulse.ingester.api;

import com.skypulse.analytics.export.FlightCsvWriter;
import com.skypulse.analytics.model.Snapshot;
import com.skypulse.ingester.budget.BudgetState;
import com.skypulse.ingester.budget.CreditBudgetTracker;
import com.skypulse.ingester.region.Region;
import com.skypulse.ingester.region.RegionCatalog;
import com.skypulse.ingester.schedule.RegionFetchScheduler;
import com.skypulse.ingester.snapshot.SnapshotStore;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Read-only snapshot endpoints.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /api/regions}: region statuses and budget state</li>
 *   <li>{@code GET /api/regions/{region}/snapshot}: latest snapshot, even if stale</li>
 *   <li>{@code GET /api/regions/{region}/analytics}: aggregates only</li>
 *   <li>{@code GET /api/regions/{region}/flights.csv}: records as CSV</li>
 *   <li>{@code GET /api/stream}: SSE snapshot notifications</li>
 *   <li>{@code GET /api/budget}: credit budget state</li>
 * </ul>
 *
 * <p>The snapshot and CSV routes accept optional {@code q}, {@code weight_class} and
 * {@code country} filters. Filters narrow {@code records} only; {@code aggregates} always describe
 * the whole region.
 */
@RestController
@RequestMapping("/api")
public class SnapshotController {
  static final MediaType TEXT_CSV = new MediaType("text", "csv");

  private final RegionCatalog catalog;
  private final SnapshotStore snapshotStore;
  private final RegionFetchScheduler scheduler;
  private final CreditBudgetTracker budget;
  private final FlightCsvWriter csvWriter;
  private final SnapshotStreamService streamService;

  public SnapshotController(
      RegionCatalog catalog,
      SnapshotStore snapshotStore,
      RegionFetchScheduler scheduler,
      CreditBudgetTracker budget,
      FlightCsvWriter csvWriter,
      SnapshotStreamService streamService) {
    this.catalog = catalog;
    this.snapshotStore = snapshotStore;
    this.scheduler = scheduler;
    this.budget = budget;
    this.csvWriter = csvWriter;
    this.streamService = streamService;
  }

  @GetMapping("/regions")
  public RegionsResponse regions() {
    List<RegionSummary> regions = catalog.ordered().stream()
        .map(region -> new RegionSummary(
            region.name(),
            region.boundingBox(),
            region.estimatedCreditCost(),
            scheduler.status(region.name()).orElse(null),
            snapshotStore.current(region.name()).map(Snapshot::capturedAt).orElse(null)))
        .toList();
    return new RegionsResponse(regions, budget.state());
  }

  @GetMapping("/regions/{region}/snapshot")
  public Snapshot snapshot(
      @PathVariable("region") String region,
      @RequestParam(value = "q", required = false) String search,
      @RequestParam(value = "weight_class", required = false) String weightClass,
      @RequestParam(value = "country", required = false) String country) {
    FlightFilter filter = QueryParser.parseFlightFilter(search, weightClass, country);
    Snapshot snapshot = requireSnapshot(region);
    if (filter.isEmpty()) {
      return snapshot;
    }
    return new Snapshot(
        snapshot.region(), snapshot.capturedAt(), filter.apply(snapshot.records()), snapshot.aggregates());
  }

  @GetMapping("/regions/{region}/analytics")
  public AnalyticsResponse analytics(@PathVariable("region") String region) {
    Snapshot snapshot = requireSnapshot(region);
    return new AnalyticsResponse(snapshot.region(), snapshot.capturedAt(), snapshot.aggregates());
  }

  @GetMapping("/regions/{region}/flights.csv")
  public ResponseEntity<String> flightsCsv(
      @PathVariable("region") String region,
      @RequestParam(value = "q", required = false) String search,
      @RequestParam(value = "weight_class", required = false) String weightClass,
      @RequestParam(value = "country", required = false) String country) {
    FlightFilter filter = QueryParser.parseFlightFilter(search, weightClass, country);
    Snapshot snapshot = requireSnapshot(region);
    return ResponseEntity.ok()
        .contentType(TEXT_CSV)
        .header(HttpHeaders.CONTENT_DISPOSITION,
            "inline; filename=\"" + snapshot.region() + "-flights.csv\"")
        .body(csvWriter.write(filter.apply(snapshot.records())));
  }

  @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream() {
    return streamService.openStream();
  }

  @GetMapping("/budget")
  public BudgetState budget() {
    return budget.state();
  }

  private Snapshot requireSnapshot(String name) {
    Region region = catalog.find(name)
        .orElseThrow(() -> new NotFoundException("unknown region: " + name));
    return snapshotStore.current(region.name())
        .orElseThrow(() -> new SnapshotNotAvailableException(region.name()));
  }
}
