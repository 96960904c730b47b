/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exporter;

import lombok.RequiredArgsConstructor;
import org.telemetry.query.data.Selection;
import org.telemetry.query.telemetry.Accountant;
import org.telemetry.query.telemetry.Report;

/** Derives the final statistics of a query from its ledger. */
@RequiredArgsConstructor
public class StatisticsReporter {

  private final String name;

  /**
   * Builds the statistics report. Results are the rows that qualified, shipped or still buffered;
   * selectivity is results per processed row, or 0 before anything was processed.
   */
  public Report buildReport(QueryStatus query, Selection hits) {
    long processed = query.getProcessed();
    long shipped = query.getShipped();
    long results = shipped + query.getCached();
    double selectivity = processed == 0 ? 0.0 : (double) results / processed;
    return Report.builder()
        .put("exporter.hits", hits.rank())
        .put("exporter.processed", processed)
        .put("exporter.results", results)
        .put("exporter.shipped", shipped)
        .put("exporter.selectivity", selectivity)
        .put("exporter.runtime", query.getRuntime())
        .build();
  }

  /** Sends the statistics to whichever of the two receivers is present. */
  public void report(
      QueryStatus query, Selection hits, Accountant accountant, StatisticsSubscriber subscriber) {
    if (subscriber != null) {
      subscriber.onStatistics(name, query.snapshot());
    }
    if (accountant != null) {
      accountant.report(buildReport(query, hits));
    }
  }
}
