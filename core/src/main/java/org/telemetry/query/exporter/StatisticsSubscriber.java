/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exporter;

/** Receives the final progress of a query, e.g. to render it in a user interface. */
public interface StatisticsSubscriber {

  /**
   * Called once when a query terminates without being killed.
   *
   * @param name name of the exporter
   * @param status copy of the query's progress ledger
   */
  void onStatistics(String name, QueryStatus status);
}
