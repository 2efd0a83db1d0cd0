/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.operator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.quarry.sql.planner.distributed.exchange.PageSerde;
import org.quarry.sql.planner.distributed.memory.MemoryTracker;
import org.quarry.sql.planner.distributed.memory.SpillFile;
import org.quarry.sql.planner.distributed.memory.SpillStore;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageBuilder;
import org.quarry.sql.planner.distributed.page.PageSchema;
import org.quarry.sql.planner.distributed.processor.ProcessorContext;
import org.quarry.sql.planner.distributed.processor.TransformProcessor;
import org.quarry.sql.planner.distributed.sort.PageComparator;
import org.quarry.sql.planner.distributed.sort.SortedPageMerger;

/**
 * Sorts its whole input. Pages are buffered under the processor's memory limit. When the next page
 * does not fit and a spill store is available, the buffered pages are sorted and written out as a
 * run; the runs are merged at the end. Without a spill store an oversized input fails the query
 * with {@link org.quarry.sql.exception.ResourceExhaustedException}.
 */
@Log4j2
public class SortProcessor extends TransformProcessor {

  private final PageSchema schema;
  private final PageComparator comparator;
  private final PageSerde serde = new PageSerde();

  private final List<Page> buffered = new ArrayList<>();
  private long bufferedBytes;
  private final List<SpillFile> runs = new ArrayList<>();

  private List<RowRef> sortedRows;
  private int emitted;
  private SortedPageMerger runMerger;
  private List<Iterator<byte[]>> runReaders;

  public SortProcessor(ProcessorContext context, PageSchema schema, PageComparator comparator) {
    super(context);
    this.schema = schema;
    this.comparator = comparator;
  }

  @Override
  protected Page process(Page page) {
    long bytes = page.getRetainedSizeBytes();
    MemoryTracker memory = context.getMemoryTracker();
    if (!memory.tryReserve(bytes)) {
      if (context.getSpillStore() != null && !buffered.isEmpty()) {
        spillRun(context.getSpillStore());
      }
      memory.reserve(bytes);
    }
    buffered.add(page);
    bufferedBytes += bytes;
    return null;
  }

  @Override
  protected Page flush() {
    if (runs.isEmpty()) {
      return nextInMemoryPage();
    }
    return nextMergedPage();
  }

  /** Returns the number of runs written to the spill store. */
  public int getSpilledRunCount() {
    return runs.size();
  }

  private Page nextInMemoryPage() {
    if (sortedRows == null) {
      sortedRows = sortBuffered();
    }
    if (emitted >= sortedRows.size()) {
      return null;
    }
    PageBuilder builder = new PageBuilder(schema);
    int end = Math.min(sortedRows.size(), emitted + context.getPageSizeRows());
    for (; emitted < end; emitted++) {
      RowRef row = sortedRows.get(emitted);
      builder.appendRow(row.page(), row.position());
    }
    return builder.build();
  }

  private Page nextMergedPage() {
    if (runMerger == null) {
      if (!buffered.isEmpty()) {
        spillRun(context.getSpillStore());
      }
      runMerger =
          new SortedPageMerger(schema, comparator, runs.size(), context.getPageSizeRows());
      runReaders = new ArrayList<>(runs.size());
      for (SpillFile run : runs) {
        runReaders.add(run.read());
      }
    }
    while (!runMerger.isFinished()) {
      for (int run = 0; run < runReaders.size(); run++) {
        Iterator<byte[]> reader = runReaders.get(run);
        while (runMerger.needsPage(run)) {
          if (reader.hasNext()) {
            runMerger.addPage(run, serde.deserialize(reader.next()));
          } else {
            runMerger.finishStream(run);
          }
        }
      }
      Page page = runMerger.merge();
      if (page != null) {
        return page;
      }
    }
    return null;
  }

  private List<RowRef> sortBuffered() {
    List<RowRef> rows = new ArrayList<>();
    for (Page page : buffered) {
      for (int position = 0; position < page.getPositionCount(); position++) {
        rows.add(new RowRef(page, position));
      }
    }
    // List.sort is stable, so equal keys keep their arrival order.
    rows.sort((a, b) -> comparator.compare(a.page(), a.position(), b.page(), b.position()));
    return rows;
  }

  private void spillRun(SpillStore spillStore) {
    List<RowRef> rows = sortBuffered();
    SpillFile run = spillStore.create(getName());
    runs.add(run);
    PageBuilder builder = new PageBuilder(schema);
    for (RowRef row : rows) {
      builder.appendRow(row.page(), row.position());
      if (builder.getRowCount() == context.getPageSizeRows()) {
        run.write(serde.serialize(builder.build()));
      }
    }
    if (!builder.isEmpty()) {
      run.write(serde.serialize(builder.build()));
    }
    log.debug(
        "{} spilled run {} with {} rows ({} bytes buffered)",
        getName(),
        runs.size(),
        rows.size(),
        bufferedBytes);
    context.getMemoryTracker().free(bufferedBytes);
    buffered.clear();
    bufferedBytes = 0;
  }

  @Override
  public void close() {
    // Closing a run also closes its reader.
    for (SpillFile run : runs) {
      run.close();
    }
    runReaders = null;
    runMerger = null;
    buffered.clear();
    super.close();
  }

  private record RowRef(Page page, int position) {}
}
