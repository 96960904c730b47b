/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression;

/** The left-hand side of a {@link Predicate}: what a row value is extracted from. */
public interface Extractor {

  /** Returns the textual form used when printing expressions. */
  String render();
}
