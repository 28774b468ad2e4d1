package ca.gc.cra.brownian.application.simulation;

import java.security.SecureRandom;
import java.util.OptionalLong;
import java.util.Random;

/**
 * Derives one independent seed per worker.
 * <p>With a global seed the derived seeds are reproducible; without one they come from system entropy.</p>
 *
 * @since 0.1.0
 */
final class WorkerSeeds {
  private WorkerSeeds() {}

  static long[] derive(OptionalLong seed, int workers) {
    Random master = seed.isPresent() ? new Random(seed.getAsLong()) : new SecureRandom();
    long[] seeds = new long[workers];
    for (int i = 0; i < workers; i++) {
      seeds[i] = master.nextLong();
    }
    return seeds;
  }
}
