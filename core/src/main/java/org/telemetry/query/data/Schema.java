/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.data;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * The layout of a {@link Batch}: a name (e.g. {@code zeek.conn}) and an ordered list of fields.
 * Two schemas are equal iff their names and fields are equal, which makes a schema usable as a
 * cache key for compiled checkers.
 */
@Getter
@EqualsAndHashCode
public class Schema {

  private final String name;
  private final List<Field> fields;

  public Schema(String name, List<Field> fields) {
    this.name = name;
    this.fields = ImmutableList.copyOf(fields);
  }

  public static Schema of(String name, Field... fields) {
    return new Schema(name, ImmutableList.copyOf(fields));
  }

  /** Returns the channel of the field with exactly this name, or -1. */
  public int indexOf(String fieldName) {
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).getName().equals(fieldName)) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public String toString() {
    return name
        + " {"
        + fields.stream().map(Field::toString).collect(Collectors.joining(", "))
        + "}";
  }
}
