/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.telemetry;

/** Telemetry endpoint collecting reports from query components. */
public interface Accountant {

  /** Announces a component that will send reports under the given name. */
  void announce(String name);

  void report(Report report);
}
