package ca.gc.cra.brownian.application.simulation;

import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Shared cap on the number of exits recorded across all workers of one run.
 * <p><strong>Thread-safety:</strong> Lock-free; every mutation is a single atomic operation.</p>
 * <p>{@link #isOpen()} is a plain read that workers use to decide whether to start another pass, while
 * {@link #tryConsume()} is the fetch-and-add that actually claims an exit. Only claims whose pre-increment value
 * is below the limit succeed.</p>
 *
 * @since 0.1.0
 */
public final class GlobalExitBudget {
  private final long limit;
  private final AtomicLong claims = new AtomicLong();

  /**
   * Creates a budget allowing {@code limit} recorded exits.
   *
   * @param limit maximum number of exits; must not be negative
   */
  public GlobalExitBudget(long limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must not be negative (was " + limit + ")");
    }
    this.limit = limit;
  }

  /**
   * Peeks whether more exits may still be recorded.
   *
   * @return {@code true} while fewer than {@code limit} claims have been made
   */
  public boolean isOpen() {
    return claims.get() < limit;
  }

  /**
   * Claims one exit.
   *
   * @return {@code true} when the claim fits within the limit and the exit may be recorded
   */
  public boolean tryConsume() {
    return claims.getAndIncrement() < limit;
  }

  /**
   * Closes the budget so every worker stops after its current step.
   */
  public void exhaust() {
    claims.accumulateAndGet(limit, Math::max);
  }

  /** Maximum number of exits this budget admits. */
  public long limit() {
    return limit;
  }

  /** Number of claims made so far, successful or not. */
  public long claims() {
    return claims.get();
  }
}
