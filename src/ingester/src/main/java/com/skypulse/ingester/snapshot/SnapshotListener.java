package com.skypulse.ingester.snapshot;

import com.skypulse.analytics.model.Snapshot;

/** Callback for accepted snapshot publishes. Runs on the publishing thread. */
@FunctionalInterface
public interface SnapshotListener {
  void onSnapshot(Snapshot snapshot);
}
