/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.processor;

/** Counters a processor keeps about the pages it moved. Written only by the owning worker. */
public class ProcessorStats {

  private long inputPages;
  private long inputRows;
  private long outputPages;
  private long outputRows;
  private long outputBytes;

  public void recordInput(int rows) {
    inputPages++;
    inputRows += rows;
  }

  public void recordOutput(int rows, long bytes) {
    outputPages++;
    outputRows += rows;
    outputBytes += bytes;
  }

  public long getInputPages() {
    return inputPages;
  }

  public long getInputRows() {
    return inputRows;
  }

  public long getOutputPages() {
    return outputPages;
  }

  public long getOutputRows() {
    return outputRows;
  }

  public long getOutputBytes() {
    return outputBytes;
  }
}
