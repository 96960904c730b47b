/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import lombok.extern.log4j.Log4j2;

/**
 * Subscription table behind {@link Monitorable}. Components delegate {@link #watch} to a tracker
 * and call {@link #disconnect} once when they go away. Watches registered after the disconnect are
 * notified immediately.
 */
@Log4j2
public class LivenessTracker implements Monitorable {

  private final List<Consumer<ExitReason>> watchers = new ArrayList<>();
  private ExitReason reason;

  @Override
  public Subscription watch(Consumer<ExitReason> listener) {
    ExitReason exitReason;
    synchronized (this) {
      if (reason == null) {
        watchers.add(listener);
        return () -> unwatch(listener);
      }
      exitReason = reason;
    }
    listener.accept(exitReason);
    return Subscription.NONE;
  }

  /** Notifies every current watcher. Subsequent calls are ignored. */
  public void disconnect(ExitReason exitReason) {
    List<Consumer<ExitReason>> notified;
    synchronized (this) {
      if (reason != null) {
        log.debug("ignores repeated disconnect with reason {}", exitReason);
        return;
      }
      reason = exitReason;
      notified = new ArrayList<>(watchers);
      watchers.clear();
    }
    for (Consumer<ExitReason> watcher : notified) {
      watcher.accept(exitReason);
    }
  }

  public synchronized boolean isDown() {
    return reason != null;
  }

  public synchronized int getWatcherCount() {
    return watchers.size();
  }

  private synchronized void unwatch(Consumer<ExitReason> listener) {
    watchers.remove(listener);
  }
}
