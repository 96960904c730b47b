/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.telemetry;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** An ordered list of measurements sent to an {@link Accountant} in one message. */
@Getter
@ToString
@EqualsAndHashCode
public class Report {

  private final List<Measurement> measurements;

  private Report(List<Measurement> measurements) {
    this.measurements = ImmutableList.copyOf(measurements);
  }

  public static Report of(String key, Object value) {
    return new Report(List.of(new Measurement(key, value)));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the value of the first measurement with the given key. */
  public Optional<Object> get(String key) {
    return measurements.stream()
        .filter(m -> m.getKey().equals(key))
        .map(Measurement::getValue)
        .findFirst();
  }

  /** Builder. */
  public static class Builder {
    private final ImmutableList.Builder<Measurement> measurements = ImmutableList.builder();

    public Builder put(String key, Object value) {
      measurements.add(new Measurement(key, value));
      return this;
    }

    public Report build() {
      return new Report(measurements.build());
    }
  }
}
