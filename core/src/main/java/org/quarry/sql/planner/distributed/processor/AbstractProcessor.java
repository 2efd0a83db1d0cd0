/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.processor;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ListenableFuture;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.port.Port;

/** Port bookkeeping and statistics shared by every processor. */
public abstract class AbstractProcessor implements Processor {

  protected final ProcessorContext context;
  private final Port[] inputs;
  private final Port[] outputs;
  private final ProcessorStats stats = new ProcessorStats();

  protected AbstractProcessor(ProcessorContext context, int inputCount, int outputCount) {
    this.context = Preconditions.checkNotNull(context, "context");
    Preconditions.checkArgument(inputCount >= 0 && outputCount >= 0, "negative port count");
    this.inputs = new Port[inputCount];
    this.outputs = new Port[outputCount];
  }

  @Override
  public String getName() {
    return context.getProcessorName();
  }

  @Override
  public ProcessorContext getContext() {
    return context;
  }

  @Override
  public List<Port> getInputPorts() {
    return Collections.unmodifiableList(Arrays.asList(inputs));
  }

  @Override
  public List<Port> getOutputPorts() {
    return Collections.unmodifiableList(Arrays.asList(outputs));
  }

  @Override
  public void attachInput(int index, Port port) {
    Preconditions.checkElementIndex(index, inputs.length, getName() + " input");
    Preconditions.checkState(
        inputs[index] == null, "%s input %s already attached", getName(), index);
    inputs[index] = port;
  }

  @Override
  public void attachOutput(int index, Port port) {
    Preconditions.checkElementIndex(index, outputs.length, getName() + " output");
    Preconditions.checkState(
        outputs[index] == null, "%s output %s already attached", getName(), index);
    outputs[index] = port;
  }

  @Override
  public ListenableFuture<?> executeAsync() {
    throw new IllegalStateException(getName() + " has no asynchronous work");
  }

  @Override
  public ProcessorStats getStats() {
    return stats;
  }

  @Override
  public void close() {
    context.getMemoryTracker().freeAll();
  }

  protected Port input(int index) {
    return inputs[index];
  }

  protected Port output(int index) {
    return outputs[index];
  }

  protected int inputCount() {
    return inputs.length;
  }

  protected int outputCount() {
    return outputs.length;
  }

  /** Pulls a page from the port and counts it. */
  protected Page pullFrom(Port port) {
    Page page = port.pull();
    if (page != null) {
      stats.recordInput(page.getPositionCount());
    }
    return page;
  }

  /** Pushes a page on the port and counts it. */
  protected void pushTo(Port port, Page page) {
    port.push(page);
    stats.recordOutput(page.getPositionCount(), page.getRetainedSizeBytes());
  }

  /** Finishes every output port. */
  protected void finishOutputs() {
    for (Port port : outputs) {
      port.finish();
    }
  }

  /** Closes every input port. */
  protected void closeInputs() {
    for (Port port : inputs) {
      port.close();
    }
  }

  /** Returns null for null or empty pages so callers never push empty batches. */
  protected static Page nonEmpty(Page page) {
    return page == null || page.getPositionCount() == 0 ? null : page;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + getName() + "}";
  }
}
