package com.skypulse.ingester.budget;

/**
 * Result of one {@link CreditBudgetTracker#authorize(int)} call.
 *
 * @param outcome granted or denied
 * @param cost credits requested
 * @param consumed credits consumed in the window after this decision
 * @param limit credit limit of the window
 */
public record BudgetDecision(Outcome outcome, int cost, long consumed, long limit) {
  public enum Outcome {
    GRANTED,
    DENIED
  }

  public boolean granted() {
    return outcome == Outcome.GRANTED;
  }
}
