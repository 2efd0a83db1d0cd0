/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.page;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Ordered list of columns shared by every page a processor produces. */
@EqualsAndHashCode
public class PageSchema {

  @Getter private final List<Column> columns;

  public PageSchema(List<Column> columns) {
    this.columns = ImmutableList.copyOf(columns);
  }

  public static PageSchema of(Column... columns) {
    return new PageSchema(List.of(columns));
  }

  public int size() {
    return columns.size();
  }

  public Column getColumn(int channel) {
    return columns.get(channel);
  }

  /**
   * Returns the channel of the named column.
   *
   * @throws IllegalArgumentException if no column has that name
   */
  public int indexOf(String name) {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).getName().equals(name)) {
        return i;
      }
    }
    throw new IllegalArgumentException("Unknown column " + name + " in " + this);
  }

  public List<String> getColumnNames() {
    return columns.stream().map(Column::getName).collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return columns.toString();
  }
}
