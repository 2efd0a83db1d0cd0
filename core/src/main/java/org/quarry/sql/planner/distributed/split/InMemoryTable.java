/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.split;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageBuilder;
import org.quarry.sql.planner.distributed.page.PageSchema;

/** A table held in memory, stored as a fixed number of data units, each a list of pages. */
@Getter
public class InMemoryTable {

  private final String name;
  private final PageSchema schema;
  private final List<List<Page>> units;

  public InMemoryTable(String name, PageSchema schema, List<List<Page>> units) {
    this.name = name;
    this.schema = schema;
    ImmutableList.Builder<List<Page>> copy = ImmutableList.builder();
    for (List<Page> unit : units) {
      for (Page page : unit) {
        Preconditions.checkArgument(
            page.getSchema().equals(schema),
            "Page schema %s does not match %s",
            page.getSchema(),
            schema);
      }
      copy.add(ImmutableList.copyOf(unit));
    }
    this.units = copy.build();
  }

  /**
   * Splits rows into {@code unitCount} contiguous data units, each cut into pages of at most
   * {@code pageSizeRows} rows.
   */
  public static InMemoryTable fromRows(
      String name, PageSchema schema, List<Object[]> rows, int unitCount, int pageSizeRows) {
    Preconditions.checkArgument(unitCount > 0, "unitCount must be positive");
    Preconditions.checkArgument(pageSizeRows > 0, "pageSizeRows must be positive");
    List<List<Page>> units = new ArrayList<>(unitCount);
    int perUnit = (rows.size() + unitCount - 1) / unitCount;
    for (int unit = 0; unit < unitCount; unit++) {
      List<Page> pages = new ArrayList<>();
      PageBuilder builder = new PageBuilder(schema);
      int end = Math.min(rows.size(), (unit + 1) * perUnit);
      for (int row = unit * perUnit; row < end; row++) {
        builder.appendRow(rows.get(row));
        if (builder.getRowCount() == pageSizeRows) {
          pages.add(builder.build());
        }
      }
      if (!builder.isEmpty()) {
        pages.add(builder.build());
      }
      units.add(pages);
    }
    return new InMemoryTable(name, schema, units);
  }

  public long getRowCount() {
    return units.stream().flatMap(List::stream).mapToLong(Page::getPositionCount).sum();
  }
}
