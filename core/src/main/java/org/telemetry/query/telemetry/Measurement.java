/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.telemetry;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** One named value of a {@link Report}. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class Measurement {

  private final String key;
  private final Object value;
}
