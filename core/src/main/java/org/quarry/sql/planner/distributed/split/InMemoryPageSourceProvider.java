/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.split;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.quarry.sql.planner.distributed.page.Block;
import org.quarry.sql.planner.distributed.page.ColumnarPage;
import org.quarry.sql.planner.distributed.page.Column;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageSchema;

/** Serves scans over {@link InMemoryTable}s, for embedding and tests. */
public class InMemoryPageSourceProvider implements PageSourceProvider {

  private final Map<String, InMemoryTable> tables = new ConcurrentHashMap<>();

  public InMemoryPageSourceProvider register(InMemoryTable table) {
    tables.put(table.getName(), table);
    return this;
  }

  @Override
  public PageSchema getSchema(String table, List<String> columns) {
    InMemoryTable memoryTable = table(table);
    if (columns.isEmpty()) {
      return memoryTable.getSchema();
    }
    List<Column> selected = new ArrayList<>(columns.size());
    for (String column : columns) {
      PageSchema schema = memoryTable.getSchema();
      selected.add(schema.getColumn(schema.indexOf(column)));
    }
    return new PageSchema(selected);
  }

  @Override
  public List<DataUnit> getDataUnits(String table) {
    InMemoryTable memoryTable = table(table);
    List<DataUnit> dataUnits = new ArrayList<>();
    for (int i = 0; i < memoryTable.getUnits().size(); i++) {
      dataUnits.add(new InMemoryDataUnit(memoryTable, i));
    }
    return dataUnits;
  }

  @Override
  public PageSource createPageSource(DataUnit dataUnit, List<String> columns) {
    Preconditions.checkArgument(
        dataUnit instanceof InMemoryDataUnit, "Not an in-memory data unit: %s", dataUnit);
    InMemoryDataUnit unit = (InMemoryDataUnit) dataUnit;
    PageSchema tableSchema = unit.getTable().getSchema();
    PageSchema schema = getSchema(unit.getTable().getName(), columns);
    int[] channels = new int[schema.size()];
    for (int i = 0; i < channels.length; i++) {
      channels[i] = tableSchema.indexOf(schema.getColumn(i).getName());
    }
    List<Page> pages = unit.getTable().getUnits().get(unit.getIndex());
    return new InMemoryPageSource(pages, schema, channels);
  }

  private InMemoryTable table(String name) {
    InMemoryTable table = tables.get(name);
    if (table == null) {
      throw new IllegalArgumentException("Unknown table " + name);
    }
    return table;
  }

  /** One data unit of an in-memory table. */
  @Getter
  @RequiredArgsConstructor
  public static class InMemoryDataUnit extends DataUnit {
    private final InMemoryTable table;
    private final int index;

    @Override
    public String getDataUnitId() {
      return table.getName() + "/" + index;
    }

    @Override
    public long getEstimatedRows() {
      return table.getUnits().get(index).stream().mapToLong(Page::getPositionCount).sum();
    }

    @Override
    public long getEstimatedSizeBytes() {
      return table.getUnits().get(index).stream().mapToLong(Page::getRetainedSizeBytes).sum();
    }

    @Override
    public Map<String, String> getProperties() {
      return ImmutableMap.of("table", table.getName(), "unit", String.valueOf(index));
    }
  }

  private static class InMemoryPageSource implements PageSource {
    private final List<Page> pages;
    private final PageSchema schema;
    private final int[] channels;
    private int next;
    private long completedBytes;

    InMemoryPageSource(List<Page> pages, PageSchema schema, int[] channels) {
      this.pages = pages;
      this.schema = schema;
      this.channels = channels;
    }

    @Override
    public Page getNextPage() {
      if (isFinished()) {
        return null;
      }
      Page page = pages.get(next++);
      List<Block> blocks = new ArrayList<>(channels.length);
      for (int channel : channels) {
        blocks.add(page.getBlock(channel));
      }
      Page projected = new ColumnarPage(schema, blocks);
      completedBytes += projected.getRetainedSizeBytes();
      return projected;
    }

    @Override
    public boolean isFinished() {
      return next >= pages.size();
    }

    @Override
    public ListenableFuture<?> isBlocked() {
      return Futures.immediateVoidFuture();
    }

    @Override
    public long getCompletedBytes() {
      return completedBytes;
    }

    @Override
    public void close() {
      next = pages.size();
    }
  }
}
