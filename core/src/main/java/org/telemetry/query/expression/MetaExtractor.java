/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Extracts metadata of a batch rather than a row value. */
@RequiredArgsConstructor
public enum MetaExtractor implements Extractor {
  /** The name of the batch schema. */
  SCHEMA("#schema");

  @Getter private final String symbol;

  @Override
  public String render() {
    return symbol;
  }
}
