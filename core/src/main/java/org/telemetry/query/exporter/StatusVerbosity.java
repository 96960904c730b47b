/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exporter;

/** Levels of detail of a status request, in increasing order. */
public enum StatusVerbosity {
  QUIET,
  INFO,
  DETAILED,
  DEBUG;

  public boolean isAtLeast(StatusVerbosity other) {
    return compareTo(other) >= 0;
  }
}
