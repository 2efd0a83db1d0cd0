/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.sort;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.quarry.sql.planner.distributed.TestPages.row;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.quarry.sql.planner.distributed.TestPages;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageSchema;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SortedPageMergerTest {

  private final PageSchema schema = TestPages.longSchema("k", "stream");
  private final PageComparator byKey = new PageComparator(List.of(SortKey.ascending("k", 0)));

  @Test
  void should_wait_until_every_open_stream_has_a_page() {
    SortedPageMerger merger = new SortedPageMerger(schema, byKey, 2, 10);
    merger.addPage(0, TestPages.page(schema, row(1L, 0L)));

    assertFalse(merger.canMerge());
    assertNull(merger.merge());
    assertTrue(merger.needsPage(1));
  }

  @Test
  void should_merge_sorted_streams_into_sorted_output() {
    // Given
    SortedPageMerger merger = new SortedPageMerger(schema, byKey, 2, 10);
    merger.addPage(0, TestPages.page(schema, row(1L, 0L), row(4L, 0L)));
    merger.addPage(1, TestPages.page(schema, row(2L, 1L), row(3L, 1L), row(9L, 1L)));

    // When: stream 0 runs dry after emitting 1, 2, 3, 4
    List<List<Object>> output = new ArrayList<>(TestPages.rows(merger.merge()));
    assertTrue(merger.needsPage(0));
    merger.finishStream(0);
    output.addAll(TestPages.rows(merger.merge()));
    merger.finishStream(1);

    // Then
    assertEquals(
        List.of(
            List.of(1L, 0L), List.of(2L, 1L), List.of(3L, 1L), List.of(4L, 0L), List.of(9L, 1L)),
        output);
    assertTrue(merger.isFinished());
  }

  @Test
  void should_break_ties_by_lower_stream_index() {
    SortedPageMerger merger = new SortedPageMerger(schema, byKey, 2, 10);
    merger.addPage(0, TestPages.page(schema, row(5L, 0L)));
    merger.addPage(1, TestPages.page(schema, row(5L, 1L)));
    merger.finishStream(0);
    merger.finishStream(1);

    Page merged = merger.merge();

    assertEquals(List.of(List.of(5L, 0L), List.of(5L, 1L)), TestPages.rows(merged));
  }

  @Test
  void should_cap_output_page_size() {
    SortedPageMerger merger = new SortedPageMerger(schema, byKey, 1, 2);
    merger.addPage(0, TestPages.page(schema, row(1L, 0L), row(2L, 0L), row(3L, 0L)));
    merger.finishStream(0);

    assertEquals(2, merger.merge().getPositionCount());
    assertEquals(1, merger.merge().getPositionCount());
    assertTrue(merger.isFinished());
  }

  @Test
  void should_order_descending_with_nulls_first() {
    PageComparator descending = new PageComparator(List.of(SortKey.descending("k", 0)));
    Page page = TestPages.page(schema, row(null, 0L), row(7L, 0L), row(3L, 0L));

    assertTrue(descending.compare(page, 0, page, 1) < 0);
    assertTrue(descending.compare(page, 1, page, 2) < 0);
    assertEquals(0, descending.compare(page, 2, page, 2));
  }
}
