/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.aggregation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.quarry.sql.planner.distributed.memory.MemoryTracker;
import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.Column;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageBuilder;
import org.quarry.sql.planner.distributed.page.PageSchema;

/**
 * Hash table from group key to accumulators, shared by the partial and the final aggregation
 * step. The partial step reads raw input rows and emits the group columns followed by the
 * intermediate values of every call. The final step reads those pages and emits the group columns
 * followed by one final value per call.
 *
 * <p>Every new group is charged to the memory tracker, which fails the query once the table
 * outgrows the processor's limit. Groups are emitted in first-seen order. BYTES key values are
 * held as {@link ByteBuffer}s so equal contents form one group.
 */
public class AggregationTable {

  private static final long GROUP_OVERHEAD_BYTES = 48;
  private static final long ACCUMULATOR_BYTES = 32;

  /** Which half of a two-step aggregation the table performs. */
  public enum Step {
    PARTIAL,
    FINAL
  }

  private final Step step;
  private final int[] groupChannels;
  private final List<AggregateCall> calls;
  private final BlockType[] accumulatorTypes;
  private final int[] inputChannels;
  private final PageSchema outputSchema;
  private final MemoryTracker memoryTracker;
  private final Map<List<Object>, Accumulator[]> groups = new LinkedHashMap<>();
  private Iterator<Map.Entry<List<Object>, Accumulator[]>> emitIterator;

  private AggregationTable(
      Step step,
      int[] groupChannels,
      List<AggregateCall> calls,
      BlockType[] accumulatorTypes,
      int[] inputChannels,
      PageSchema outputSchema,
      MemoryTracker memoryTracker) {
    this.step = step;
    this.groupChannels = groupChannels;
    this.calls = ImmutableList.copyOf(calls);
    this.accumulatorTypes = accumulatorTypes;
    this.inputChannels = inputChannels;
    this.outputSchema = outputSchema;
    this.memoryTracker = memoryTracker;
    if (groupChannels.length == 0) {
      // A global aggregate yields one row even over empty input.
      groupFor(List.of());
    }
  }

  /** Creates the table of the partial step over raw input rows. */
  public static AggregationTable partial(
      PageSchema inputSchema,
      int[] groupChannels,
      List<AggregateCall> calls,
      MemoryTracker memoryTracker) {
    BlockType[] types = new BlockType[calls.size()];
    int[] channels = new int[calls.size()];
    for (int i = 0; i < calls.size(); i++) {
      types[i] = inputType(inputSchema, calls.get(i));
      channels[i] = calls.get(i).getInputChannel();
    }
    return new AggregationTable(
        Step.PARTIAL,
        groupChannels.clone(),
        calls,
        types,
        channels,
        partialOutputSchema(inputSchema, groupChannels, calls),
        memoryTracker);
  }

  /** Creates the table of the final step over pages produced by the partial step. */
  public static AggregationTable finalStep(
      PageSchema intermediateSchema,
      int groupCount,
      List<AggregateCall> calls,
      MemoryTracker memoryTracker) {
    BlockType[] types = new BlockType[calls.size()];
    int[] channels = intermediateChannels(intermediateSchema, groupCount, calls);
    for (int i = 0; i < calls.size(); i++) {
      types[i] = intermediateSchema.getColumn(channels[i]).getType();
    }
    int[] groupChannels = new int[groupCount];
    Arrays.setAll(groupChannels, i -> i);
    return new AggregationTable(
        Step.FINAL,
        groupChannels,
        calls,
        types,
        channels,
        finalOutputSchema(intermediateSchema, groupCount, calls),
        memoryTracker);
  }

  /** Returns the schema of the pages the partial step emits. */
  public static PageSchema partialOutputSchema(
      PageSchema inputSchema, int[] groupChannels, List<AggregateCall> calls) {
    List<Column> columns = new ArrayList<>();
    for (int channel : groupChannels) {
      columns.add(inputSchema.getColumn(channel));
    }
    for (AggregateCall call : calls) {
      AggregateFunction function = call.getFunction();
      List<BlockType> types = function.getIntermediateTypes(inputType(inputSchema, call));
      if (types.size() == 1) {
        columns.add(
            new Column(
                call.getOutputName(), types.get(0), function != AggregateFunction.COUNT));
      } else {
        columns.add(Column.notNull(call.getOutputName() + "$sum", types.get(0)));
        columns.add(Column.notNull(call.getOutputName() + "$count", types.get(1)));
      }
    }
    return new PageSchema(columns);
  }

  /** Returns the schema of the pages the final step emits. */
  public static PageSchema finalOutputSchema(
      PageSchema intermediateSchema, int groupCount, List<AggregateCall> calls) {
    int[] channels = intermediateChannels(intermediateSchema, groupCount, calls);
    List<Column> columns = new ArrayList<>(intermediateSchema.getColumns().subList(0, groupCount));
    for (int i = 0; i < calls.size(); i++) {
      AggregateFunction function = calls.get(i).getFunction();
      BlockType type = intermediateSchema.getColumn(channels[i]).getType();
      columns.add(
          new Column(
              calls.get(i).getOutputName(),
              function.getOutputType(type),
              function.isOutputNullable()));
    }
    return new PageSchema(columns);
  }

  private static BlockType inputType(PageSchema inputSchema, AggregateCall call) {
    if (call.isCountAll()) {
      return BlockType.LONG;
    }
    Preconditions.checkElementIndex(
        call.getInputChannel(), inputSchema.size(), "input channel of " + call);
    BlockType type = inputSchema.getColumn(call.getInputChannel()).getType();
    call.getFunction().validate(type);
    return type;
  }

  private static int[] intermediateChannels(
      PageSchema intermediateSchema, int groupCount, List<AggregateCall> calls) {
    int[] channels = new int[calls.size()];
    int channel = groupCount;
    for (int i = 0; i < calls.size(); i++) {
      channels[i] = channel;
      channel += calls.get(i).getFunction() == AggregateFunction.AVG ? 2 : 1;
    }
    Preconditions.checkArgument(
        channel == intermediateSchema.size(),
        "Intermediate schema %s does not match %s group columns and calls %s",
        intermediateSchema,
        groupCount,
        calls);
    return channels;
  }

  /** Folds every row of the page into the table. */
  public void addPage(Page page) {
    Object[] row = step == Step.FINAL ? new Object[page.getChannelCount()] : null;
    for (int position = 0; position < page.getPositionCount(); position++) {
      Accumulator[] accumulators = groupFor(groupKey(page, position));
      if (step == Step.PARTIAL) {
        for (int i = 0; i < accumulators.length; i++) {
          accumulators[i].addInput(
              inputChannels[i] == AggregateCall.ALL_ROWS
                  ? Boolean.TRUE
                  : page.getValue(position, inputChannels[i]));
        }
      } else {
        for (int channel = 0; channel < row.length; channel++) {
          row[channel] = page.getValue(position, channel);
        }
        for (int i = 0; i < accumulators.length; i++) {
          accumulators[i].addIntermediate(row, inputChannels[i]);
        }
      }
    }
  }

  private List<Object> groupKey(Page page, int position) {
    if (groupChannels.length == 0) {
      return List.of();
    }
    Object[] key = new Object[groupChannels.length];
    for (int i = 0; i < groupChannels.length; i++) {
      Object value = page.getValue(position, groupChannels[i]);
      key[i] = value instanceof byte[] ? ByteBuffer.wrap((byte[]) value) : value;
    }
    return Arrays.asList(key);
  }

  private Accumulator[] groupFor(List<Object> key) {
    Accumulator[] accumulators = groups.get(key);
    if (accumulators == null) {
      memoryTracker.reserve(estimateGroupBytes(key));
      accumulators = new Accumulator[calls.size()];
      for (int i = 0; i < accumulators.length; i++) {
        accumulators[i] = calls.get(i).getFunction().createAccumulator(accumulatorTypes[i]);
      }
      groups.put(key, accumulators);
    }
    return accumulators;
  }

  private long estimateGroupBytes(List<Object> key) {
    long bytes = GROUP_OVERHEAD_BYTES + ACCUMULATOR_BYTES * calls.size();
    for (int i = 0; i < key.size(); i++) {
      Object value = keyValue(key.get(i));
      bytes += value == null ? 8 : outputSchema.getColumn(i).getType().estimateSize(value);
    }
    return bytes;
  }

  private static Object keyValue(Object value) {
    return value instanceof ByteBuffer ? ((ByteBuffer) value).array() : value;
  }

  public int getGroupCount() {
    return groups.size();
  }

  public PageSchema getOutputSchema() {
    return outputSchema;
  }

  /**
   * Emits the next page of at most {@code maxRows} groups, or null once every group has been
   * emitted. No rows may be added after the first call.
   */
  public Page nextOutputPage(int maxRows) {
    if (emitIterator == null) {
      emitIterator = groups.entrySet().iterator();
    }
    if (!emitIterator.hasNext()) {
      return null;
    }
    PageBuilder builder = new PageBuilder(outputSchema);
    Object[] row = new Object[outputSchema.size()];
    while (emitIterator.hasNext() && builder.getRowCount() < maxRows) {
      Map.Entry<List<Object>, Accumulator[]> entry = emitIterator.next();
      List<Object> key = entry.getKey();
      for (int i = 0; i < key.size(); i++) {
        row[i] = keyValue(key.get(i));
      }
      int channel = key.size();
      for (int i = 0; i < calls.size(); i++) {
        Accumulator accumulator = entry.getValue()[i];
        if (step == Step.PARTIAL) {
          accumulator.writeIntermediate(row, channel);
          channel += calls.get(i).getFunction() == AggregateFunction.AVG ? 2 : 1;
        } else {
          row[channel++] = accumulator.evaluateFinal();
        }
      }
      builder.appendRow(row);
    }
    return builder.build();
  }
}
