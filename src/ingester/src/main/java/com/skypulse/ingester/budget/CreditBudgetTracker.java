package com.skypulse.ingester.budget;

import com.skypulse.ingester.config.ConfigurationException;
import com.skypulse.ingester.config.IngesterProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rolling-window ledger of OpenSky credits spent by this process.
 *
 * <p>Credits are recorded at authorization, before any network call, and are never refunded. Within
 * any window the granted total never exceeds the configured daily limit.
 */
@Component
public class CreditBudgetTracker {
  private static final Logger log = LoggerFactory.getLogger(CreditBudgetTracker.class);
  static final long DEFAULT_WINDOW_HOURS = 24L;

  private final long limit;
  private final Duration window;
  private final int[] warnThresholds;
  private final Clock clock;
  private final Deque<Entry> ledger = new ArrayDeque<>();
  private final Counter grantedCounter;
  private final Counter deniedCounter;

  private long consumed;
  private int warnLevel;

  private record Entry(Instant at, int cost) {}

  public CreditBudgetTracker(IngesterProperties properties, MeterRegistry meterRegistry, Clock clock) {
    IngesterProperties.Budget budget = properties.budget();
    if (budget == null || budget.dailyLimit() <= 0) {
      throw new ConfigurationException("ingester.budget.daily-limit must be positive");
    }
    this.limit = budget.dailyLimit();
    this.window = Duration.ofHours(budget.windowHours() > 0 ? budget.windowHours() : DEFAULT_WINDOW_HOURS);
    this.warnThresholds = new int[] {
        budget.warn50() > 0 ? budget.warn50() : 50,
        budget.warn80() > 0 ? budget.warn80() : 80,
        budget.warn95() > 0 ? budget.warn95() : 95};
    this.clock = clock;

    this.grantedCounter = Counter.builder("ingester.budget.decisions.total")
        .description("Credit budget decisions (by outcome)")
        .tag("outcome", "granted")
        .register(meterRegistry);
    this.deniedCounter = Counter.builder("ingester.budget.decisions.total")
        .description("Credit budget decisions (by outcome)")
        .tag("outcome", "denied")
        .register(meterRegistry);
    Gauge.builder("ingester.budget.consumed", this, tracker -> tracker.state().consumed())
        .description("Credits consumed in the rolling window")
        .register(meterRegistry);
    Gauge.builder("ingester.budget.remaining", this, tracker -> tracker.state().remaining())
        .description("Credits remaining in the rolling window")
        .register(meterRegistry);
    Gauge.builder("ingester.budget.limit", this, tracker -> tracker.limit)
        .description("Credit limit of the rolling window")
        .register(meterRegistry);

    log.info("Credit budget: limit={} per {}h", limit, window.toHours());
  }

  /**
   * Grants {@code cost} credits if the window still has room, recording them immediately.
   *
   * @param cost positive number of credits
   * @return the decision with the consumed total after it
   */
  public synchronized BudgetDecision authorize(int cost) {
    if (cost <= 0) {
      throw new IllegalArgumentException("cost must be positive: " + cost);
    }
    Instant now = clock.instant();
    evict(now);
    if (consumed + cost > limit) {
      deniedCounter.increment();
      log.debug("Budget denied: cost={}, consumed={}, limit={}", cost, consumed, limit);
      return new BudgetDecision(BudgetDecision.Outcome.DENIED, cost, consumed, limit);
    }
    ledger.addLast(new Entry(now, cost));
    consumed += cost;
    grantedCounter.increment();
    updateWarnLevel();
    return new BudgetDecision(BudgetDecision.Outcome.GRANTED, cost, consumed, limit);
  }

  public synchronized BudgetState state() {
    evict(clock.instant());
    updateWarnLevel();
    return new BudgetState(
        consumed, limit - consumed, limit, window.toHours(), limit == 0 ? 0.0 : consumed * 100.0 / limit);
  }

  /** Time until the oldest ledger entry leaves the window; zero when the ledger is empty. */
  public synchronized Duration untilNextRelease() {
    Instant now = clock.instant();
    evict(now);
    Entry oldest = ledger.peekFirst();
    if (oldest == null) {
      return Duration.ZERO;
    }
    return Duration.between(now, oldest.at().plus(window));
  }

  private void evict(Instant now) {
    Instant cutoff = now.minus(window);
    while (!ledger.isEmpty() && !ledger.peekFirst().at().isAfter(cutoff)) {
      consumed -= ledger.pollFirst().cost();
    }
  }

  private void updateWarnLevel() {
    double percent = consumed * 100.0 / limit;
    int level = 0;
    for (int threshold : warnThresholds) {
      if (percent >= threshold) {
        level = threshold;
      }
    }
    if (level == warnLevel) {
      return;
    }
    if (level > warnLevel) {
      log.warn("Credit budget at {}% ({} of {} used)", level, consumed, limit);
    } else {
      log.info("Credit budget back below {}% ({} of {} used)", warnLevel, consumed, limit);
    }
    warnLevel = level;
  }
}
