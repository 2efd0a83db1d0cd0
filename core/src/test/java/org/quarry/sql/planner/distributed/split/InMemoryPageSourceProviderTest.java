/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.split;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.quarry.sql.planner.distributed.TestPages;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageSchema;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class InMemoryPageSourceProviderTest {

  private final PageSchema schema = TestPages.longSchema("a", "b");

  private InMemoryPageSourceProvider provider() {
    List<Object[]> rows = new ArrayList<>();
    for (long i = 1; i <= 7; i++) {
      rows.add(TestPages.row(i, i * 10));
    }
    return new InMemoryPageSourceProvider()
        .register(InMemoryTable.fromRows("t", schema, rows, 3, 2));
  }

  @Test
  void should_split_rows_into_contiguous_units() {
    InMemoryTable table =
        InMemoryTable.fromRows(
            "t", schema, List.of(TestPages.row(1L, 1L), TestPages.row(2L, 2L)), 3, 10);

    assertEquals(3, table.getUnits().size());
    assertEquals(2, table.getRowCount());
    assertTrue(table.getUnits().get(2).isEmpty());
  }

  @Test
  void should_list_one_data_unit_per_table_unit() {
    List<DataUnit> units = provider().getDataUnits("t");

    assertEquals(3, units.size());
    assertEquals("t/0", units.get(0).getDataUnitId());
    assertEquals(3, units.get(0).getEstimatedRows());
    assertEquals("1", units.get(1).getProperties().get("unit"));
  }

  @Test
  void should_project_requested_columns() {
    InMemoryPageSourceProvider provider = provider();
    DataUnit unit = provider.getDataUnits("t").get(0);

    PageSource source = provider.createPageSource(unit, List.of("b"));
    Page first = source.getNextPage();

    assertEquals(List.of("b"), first.getSchema().getColumnNames());
    assertEquals(2, first.getPositionCount());
    assertEquals(10L, first.getValue(0, 0));
    assertTrue(source.isBlocked().isDone());

    source.getNextPage();
    assertTrue(source.isFinished());
    assertNull(source.getNextPage());
    assertTrue(source.getCompletedBytes() > 0);
    source.close();
  }

  @Test
  void should_return_full_schema_for_empty_column_list() {
    assertEquals(schema, provider().getSchema("t", List.of()));
  }

  @Test
  void should_reject_unknown_table() {
    assertThrows(IllegalArgumentException.class, () -> provider().getDataUnits("missing"));
  }
}
