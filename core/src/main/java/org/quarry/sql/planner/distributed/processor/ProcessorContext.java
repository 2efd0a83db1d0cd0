/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.processor;

import org.quarry.sql.planner.distributed.memory.MemoryTracker;
import org.quarry.sql.planner.distributed.memory.SpillStore;

/**
 * Runtime context available to processors during execution. Provides identity, lane, memory
 * limits and the optional spill area.
 */
public class ProcessorContext {

  public static final int DEFAULT_PAGE_SIZE_ROWS = 1024;

  private final String processorName;
  private final String stageId;
  private final int lane;
  private final long memoryLimitBytes;
  private final int pageSizeRows;
  private final SpillStore spillStore;
  private final MemoryTracker memoryTracker;

  public ProcessorContext(
      String processorName,
      String stageId,
      int lane,
      long memoryLimitBytes,
      int pageSizeRows,
      SpillStore spillStore) {
    this.processorName = processorName;
    this.stageId = stageId;
    this.lane = lane;
    this.memoryLimitBytes = memoryLimitBytes;
    this.pageSizeRows = pageSizeRows;
    this.spillStore = spillStore;
    this.memoryTracker = new MemoryTracker(processorName, memoryLimitBytes);
  }

  /** Returns the unique name of the processor owning this context. */
  public String getProcessorName() {
    return processorName;
  }

  /** Returns the id of the plan node the processor was built from. */
  public String getStageId() {
    return stageId;
  }

  /** Returns the lane (parallel replica index) of the processor. */
  public int getLane() {
    return lane;
  }

  /** Returns the memory limit in bytes for this processor. */
  public long getMemoryLimitBytes() {
    return memoryLimitBytes;
  }

  /** Returns the target number of rows per produced page. */
  public int getPageSizeRows() {
    return pageSizeRows;
  }

  /** Returns the spill area, or null when spilling is disabled. */
  public SpillStore getSpillStore() {
    return spillStore;
  }

  public MemoryTracker getMemoryTracker() {
    return memoryTracker;
  }

  /** Creates a default context for testing. */
  public static ProcessorContext createDefault(String processorName) {
    return new ProcessorContext(
        processorName, "default-stage", 0, Long.MAX_VALUE, DEFAULT_PAGE_SIZE_ROWS, null);
  }
}
