/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.pipeline;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.quarry.sql.exception.PipelineConstructionException;
import org.quarry.sql.planner.distributed.operator.ResultCollector;
import org.quarry.sql.planner.distributed.port.Port;
import org.quarry.sql.planner.distributed.processor.Processor;

/**
 * The processor graph of one query, held as an arena: the pipeline owns every processor and every
 * port, and processors refer to each other only through ports. After {@link #validate()} the
 * processors are listed in topological order and a processor's id is its index in that order.
 */
public class Pipeline {

  private final String pipelineId;
  private final PipelineContext context;
  private List<Processor> processors = new ArrayList<>();
  private final List<Port> ports = new ArrayList<>();
  private final Map<Processor, Integer> ids = new IdentityHashMap<>();
  private final List<String> exchangeIds = new ArrayList<>();
  private ResultCollector resultCollector;
  private boolean validated;

  public Pipeline(String pipelineId) {
    this.pipelineId = pipelineId;
    this.context = new PipelineContext(pipelineId);
  }

  public String getPipelineId() {
    return pipelineId;
  }

  public PipelineContext getContext() {
    return context;
  }

  /** Adds a processor to the arena. */
  public <P extends Processor> P add(P processor) {
    Preconditions.checkState(!validated, "Pipeline %s is already validated", pipelineId);
    Preconditions.checkArgument(
        ids.putIfAbsent(processor, processors.size()) == null,
        "%s added twice",
        processor.getName());
    processors.add(processor);
    return processor;
  }

  /** Connects an output of the producer to an input of the consumer with a new port. */
  public Port connect(Processor producer, int outputIndex, Processor consumer, int inputIndex) {
    Preconditions.checkState(!validated, "Pipeline %s is already validated", pipelineId);
    Preconditions.checkArgument(ids.containsKey(producer), "%s is not in the pipeline", producer);
    Preconditions.checkArgument(ids.containsKey(consumer), "%s is not in the pipeline", consumer);
    Port port = new Port(ports.size());
    port.bind(producer, consumer);
    producer.attachOutput(outputIndex, port);
    consumer.attachInput(inputIndex, port);
    ports.add(port);
    return port;
  }

  /**
   * Checks that every port of every processor is connected and that the graph is acyclic, then
   * orders the processors topologically.
   *
   * @throws PipelineConstructionException on a dangling port or a cycle
   */
  public void validate() {
    if (validated) {
      return;
    }
    for (Processor processor : processors) {
      checkConnected(processor, processor.getInputPorts(), "input");
      checkConnected(processor, processor.getOutputPorts(), "output");
    }
    Map<Processor, Integer> inDegree = new IdentityHashMap<>();
    Deque<Processor> ready = new ArrayDeque<>();
    for (Processor processor : processors) {
      inDegree.put(processor, processor.getInputPorts().size());
      if (processor.getInputPorts().isEmpty()) {
        ready.add(processor);
      }
    }
    List<Processor> ordered = new ArrayList<>(processors.size());
    while (!ready.isEmpty()) {
      Processor processor = ready.poll();
      ordered.add(processor);
      for (Port port : processor.getOutputPorts()) {
        Processor consumer = port.getConsumer();
        if (inDegree.merge(consumer, -1, Integer::sum) == 0) {
          ready.add(consumer);
        }
      }
    }
    if (ordered.size() != processors.size()) {
      throw new PipelineConstructionException(
          "Pipeline " + pipelineId + " contains a cycle");
    }
    processors = ordered;
    ids.clear();
    for (int i = 0; i < ordered.size(); i++) {
      ids.put(ordered.get(i), i);
    }
    validated = true;
  }

  private void checkConnected(Processor processor, List<Port> ports, String side) {
    for (int i = 0; i < ports.size(); i++) {
      if (ports.get(i) == null) {
        throw new PipelineConstructionException(
            "Dangling " + side + " port " + i + " of " + processor.getName());
      }
    }
  }

  public boolean isValidated() {
    return validated;
  }

  /** Returns the processors, in topological order once validated. */
  public List<Processor> getProcessors() {
    return Collections.unmodifiableList(processors);
  }

  /** Returns the id of a processor: its position in topological order once validated. */
  public int getProcessorId(Processor processor) {
    Integer id = ids.get(processor);
    Preconditions.checkArgument(id != null, "%s is not in the pipeline", processor);
    return id;
  }

  public List<Port> getPorts() {
    return Collections.unmodifiableList(ports);
  }

  /** Returns the number of pages sitting in port slots right now. */
  public int bufferedPageCount() {
    int count = 0;
    for (Port port : ports) {
      if (port.hasData()) {
        count++;
      }
    }
    return count;
  }

  void addExchangeId(String exchangeId) {
    exchangeIds.add(exchangeId);
  }

  /** Returns the ids of the exchanges created for this pipeline. */
  public List<String> getExchangeIds() {
    return Collections.unmodifiableList(exchangeIds);
  }

  public void setResultCollector(ResultCollector resultCollector) {
    this.resultCollector = resultCollector;
  }

  /** Returns the collector of the RESULT sink, or null for pipelines built by hand. */
  public ResultCollector getResultCollector() {
    return resultCollector;
  }

  @Override
  public String toString() {
    return "Pipeline{" + pipelineId + ", processors=" + processors.size() + ", ports="
        + ports.size() + "}";
  }
}
