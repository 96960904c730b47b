/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.component;

import java.util.UUID;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Reply of the index to a new query. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class LookupHandle {

  /** Identifies the lookup in subsequent partition requests. */
  private final UUID id;

  /** Total number of partitions that qualify for the query. */
  private final int partitions;

  /** Number of partitions the index already scheduled for the first batch of hits. */
  private final int scheduled;
}
