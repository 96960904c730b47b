/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exporter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Progress ledger of one query. Mutated only by the owning {@link Exporter}; everybody else sees
 * copies made by {@link #snapshot()}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class QueryStatus {

  /** Partitions that qualified for the query. */
  long expected;

  /** Partitions whose hits were fully folded in. */
  long received;

  /** Partitions requested from the index by the most recent request. */
  long scheduled;

  /** Archive round-trips started. */
  long lookupsIssued;

  /** Archive round-trips completed. */
  long lookupsComplete;

  /** Rows evaluated by checkers. */
  long processed;

  /** Rows waiting in the result buffer. */
  long cached;

  /** Rows the sinks asked for and did not get yet. */
  long requested;

  /** Rows shipped to the sinks. */
  long shipped;

  /** Time since the query started, updated whenever the index reports progress. */
  Duration runtime = Duration.ZERO;

  /** Returns true iff all expected partitions arrived and no archive round-trip is pending. */
  public boolean isFinished() {
    return received == expected && lookupsIssued == lookupsComplete;
  }

  public QueryStatus snapshot() {
    QueryStatus copy = new QueryStatus();
    copy.expected = expected;
    copy.received = received;
    copy.scheduled = scheduled;
    copy.lookupsIssued = lookupsIssued;
    copy.lookupsComplete = lookupsComplete;
    copy.processed = processed;
    copy.cached = cached;
    copy.requested = requested;
    copy.shipped = shipped;
    copy.runtime = runtime;
    return copy;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("expected", expected);
    map.put("received", received);
    map.put("scheduled", scheduled);
    map.put("lookups-issued", lookupsIssued);
    map.put("lookups-complete", lookupsComplete);
    map.put("processed", processed);
    map.put("cached", cached);
    map.put("requested", requested);
    map.put("shipped", shipped);
    map.put("runtime", runtime.toString());
    return map;
  }
}
