package io.intellixity.quarry.redis;

import java.util.List;

/** Receives each SCAN batch as it arrives so callers can stream partial results. */
@FunctionalInterface
public interface ScanProgressListener {
  ScanProgressListener NONE = (iteration, maxIterations, keysFound, batch) -> {};

  void onBatch(int iteration, int maxIterations, int keysFound, List<String> batch);
}
