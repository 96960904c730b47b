/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.importer;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Range {@code [next, end)} of ids reserved by the importer and not handed out yet. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class IdBlock {

  private final long next;
  private final long end;

  public long available() {
    return end - next;
  }

  IdBlock advance(long count) {
    return new IdBlock(next + count, end);
  }

  IdBlock extend(long size) {
    return new IdBlock(next, end + size);
  }
}
