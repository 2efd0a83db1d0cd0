/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.pipeline;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.quarry.sql.common.setting.Settings;
import org.quarry.sql.exception.PipelineConstructionException;
import org.quarry.sql.exception.QueryEngineException;
import org.quarry.sql.planner.distributed.aggregation.AggregateCall;
import org.quarry.sql.planner.distributed.aggregation.AggregationTable;
import org.quarry.sql.planner.distributed.dataunit.DataUnitAssignment;
import org.quarry.sql.planner.distributed.exchange.ExchangeManager;
import org.quarry.sql.planner.distributed.exchange.ExchangeSinkProcessor;
import org.quarry.sql.planner.distributed.exchange.ExchangeSourceProcessor;
import org.quarry.sql.planner.distributed.exchange.ExchangeTransport;
import org.quarry.sql.planner.distributed.exchange.ExchangeType;
import org.quarry.sql.planner.distributed.exchange.MergingExchangeSourceProcessor;
import org.quarry.sql.planner.distributed.exchange.PartitioningScheme;
import org.quarry.sql.planner.distributed.expression.Expression;
import org.quarry.sql.planner.distributed.memory.SpillStore;
import org.quarry.sql.planner.distributed.operator.FilterProcessor;
import org.quarry.sql.planner.distributed.operator.HashAggregateBuildProcessor;
import org.quarry.sql.planner.distributed.operator.HashAggregateFinalizeProcessor;
import org.quarry.sql.planner.distributed.operator.LimitProcessor;
import org.quarry.sql.planner.distributed.operator.ProjectProcessor;
import org.quarry.sql.planner.distributed.operator.ResultCollector;
import org.quarry.sql.planner.distributed.operator.ResultSinkProcessor;
import org.quarry.sql.planner.distributed.operator.SortProcessor;
import org.quarry.sql.planner.distributed.operator.TableScanSource;
import org.quarry.sql.planner.distributed.operator.ValuesSource;
import org.quarry.sql.planner.distributed.page.Column;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageSchema;
import org.quarry.sql.planner.distributed.processor.DuplicateProcessor;
import org.quarry.sql.planner.distributed.processor.Processor;
import org.quarry.sql.planner.distributed.processor.ProcessorContext;
import org.quarry.sql.planner.distributed.processor.SortedMergeProcessor;
import org.quarry.sql.planner.distributed.processor.UnionProcessor;
import org.quarry.sql.planner.distributed.sort.PageComparator;
import org.quarry.sql.planner.distributed.sort.SortKey;
import org.quarry.sql.planner.distributed.split.DataUnit;
import org.quarry.sql.planner.distributed.split.PageSource;
import org.quarry.sql.planner.distributed.split.PageSourceProvider;
import org.quarry.sql.planner.physical.PhysicalOperatorNode;
import org.quarry.sql.planner.physical.PhysicalOperatorNode.Params;
import org.quarry.sql.planner.physical.PhysicalOperatorType;
import org.quarry.sql.planner.physical.PhysicalPlan;

/**
 * Builds the processor graph of a physical plan.
 *
 * <ul>
 *   <li>Every plan node becomes one processor per lane. SCAN lanes read disjoint data units.
 *   <li>Unary operators keep the lane count of their input.
 *   <li>EXCHANGE becomes one sender per input lane and one receiver per declared destination,
 *       bound to a transport from the {@link ExchangeManager}.
 *   <li>MERGE collapses every lane of every child into one lane.
 *   <li>A node read by several parents is fanned out through {@link DuplicateProcessor}s.
 *   <li>RESULT must receive exactly one lane.
 * </ul>
 *
 * Invalid plans are rejected with {@link PipelineConstructionException}.
 */
@Log4j2
public class PipelineBuilder {

  private final Settings settings;
  private final PageSourceProvider pageSourceProvider;
  private final DataUnitAssignment dataUnitAssignment;
  private final ExchangeManager exchangeManager;
  private final SpillStore spillStore;

  public PipelineBuilder(
      Settings settings,
      PageSourceProvider pageSourceProvider,
      DataUnitAssignment dataUnitAssignment,
      ExchangeManager exchangeManager,
      SpillStore spillStore) {
    this.settings = settings;
    this.pageSourceProvider = pageSourceProvider;
    this.dataUnitAssignment = dataUnitAssignment;
    this.exchangeManager = exchangeManager;
    this.spillStore = spillStore;
  }

  /**
   * Builds and validates the pipeline of a plan.
   *
   * @param plan the physical plan, rooted at a RESULT node
   * @param pipelineId id of the pipeline, also used to name its exchanges
   * @throws PipelineConstructionException if the plan is invalid
   */
  public Pipeline build(PhysicalPlan plan, String pipelineId) {
    PhysicalOperatorNode root = plan.getRoot();
    checkAcyclic(root, new IdentityHashMap<>());
    if (root.getOperatorType() != PhysicalOperatorType.RESULT) {
      throw new PipelineConstructionException(
          "Plan root must be RESULT, got " + root.getOperatorType());
    }
    Build build = new Build(new Pipeline(pipelineId), countParents(root));
    try {
      build.lanes(root);
      build.pipeline.validate();
    } catch (RuntimeException e) {
      build.abandon();
      throw e;
    }
    log.debug(
        "Built pipeline {} with {} processors and {} ports",
        pipelineId,
        build.pipeline.getProcessors().size(),
        build.pipeline.getPorts().size());
    return build.pipeline;
  }

  private static void checkAcyclic(
      PhysicalOperatorNode node, Map<PhysicalOperatorNode, Boolean> visiting) {
    Boolean state = visiting.get(node);
    if (Boolean.TRUE.equals(state)) {
      throw new PipelineConstructionException("Plan contains a cycle through node " + node.getId());
    }
    if (state != null) {
      return;
    }
    visiting.put(node, true);
    for (PhysicalOperatorNode child : node.getChildren()) {
      checkAcyclic(child, visiting);
    }
    visiting.put(node, false);
  }

  private static Map<PhysicalOperatorNode, Integer> countParents(PhysicalOperatorNode root) {
    Map<PhysicalOperatorNode, Integer> parents = new IdentityHashMap<>();
    List<PhysicalOperatorNode> pending = new ArrayList<>(List.of(root));
    Map<PhysicalOperatorNode, Boolean> seen = new IdentityHashMap<>();
    while (!pending.isEmpty()) {
      PhysicalOperatorNode node = pending.remove(pending.size() - 1);
      if (seen.put(node, true) != null) {
        continue;
      }
      for (PhysicalOperatorNode child : node.getChildren()) {
        parents.merge(child, 1, Integer::sum);
        pending.add(child);
      }
    }
    return parents;
  }

  /** The lanes a plan node produces: one producing processor per lane, all with one schema. */
  private static final class Lanes {
    private final PageSchema schema;
    private final List<Processor> producers;
    private final boolean fannedOut;
    private int nextOutput;

    Lanes(PageSchema schema, List<Processor> producers, boolean fannedOut) {
      this.schema = schema;
      this.producers = producers;
      this.fannedOut = fannedOut;
    }

    int size() {
      return producers.size();
    }

    /** Claims the output index a new parent reads every lane from. */
    int claimOutput() {
      if (fannedOut) {
        return nextOutput++;
      }
      return nextOutput++ == 0 ? 0 : -1;
    }
  }

  /** State of one build. */
  private final class Build {
    private final Pipeline pipeline;
    private final Map<PhysicalOperatorNode, Integer> parentCounts;
    private final Map<PhysicalOperatorNode, Lanes> built = new IdentityHashMap<>();

    Build(Pipeline pipeline, Map<PhysicalOperatorNode, Integer> parentCounts) {
      this.pipeline = pipeline;
      this.parentCounts = parentCounts;
    }

    Lanes lanes(PhysicalOperatorNode node) {
      Lanes lanes = built.get(node);
      if (lanes != null) {
        return lanes;
      }
      try {
        lanes = buildNode(node);
      } catch (QueryEngineException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new PipelineConstructionException(
            "Invalid node " + node.getId() + " (" + node.getOperatorType() + "): " + e.getMessage(),
            e);
      }
      int parents = parentCounts.getOrDefault(node, 0);
      if (parents > 1) {
        List<Processor> duplicates = new ArrayList<>(lanes.size());
        for (int lane = 0; lane < lanes.size(); lane++) {
          DuplicateProcessor duplicate =
              pipeline.add(
                  new DuplicateProcessor(context(node, "duplicate", lane, false), parents));
          pipeline.connect(lanes.producers.get(lane), 0, duplicate, 0);
          duplicates.add(duplicate);
        }
        lanes = new Lanes(lanes.schema, duplicates, true);
      }
      built.put(node, lanes);
      return lanes;
    }

    private Lanes buildNode(PhysicalOperatorNode node) {
      switch (node.getOperatorType()) {
        case SCAN:
          return scan(node);
        case VALUES:
          return values(node);
        case MERGE:
          return merge(node);
        case EXCHANGE:
          return exchange(node);
        case RESULT:
          return result(node);
        default:
          return unary(node);
      }
    }

    private Lanes scan(PhysicalOperatorNode node) {
      checkChildCount(node, 0);
      String table = node.getParam(Params.TABLE, String.class);
      List<String> columns = node.getOptionalListParam(Params.COLUMNS, String.class);
      PageSchema schema = pageSourceProvider.getSchema(table, columns);
      int laneCount = parallelism(node);
      List<DataUnit> dataUnits = pageSourceProvider.getDataUnits(table);
      List<List<DataUnit>> assignment = dataUnitAssignment.assign(dataUnits, laneCount);
      if (assignment.size() != laneCount) {
        throw new PipelineConstructionException(
            "Data unit assignment for " + node.getId() + " returned " + assignment.size()
                + " lanes, expected " + laneCount);
      }
      List<Processor> producers = new ArrayList<>(laneCount);
      for (int lane = 0; lane < laneCount; lane++) {
        List<PageSource> sources = new ArrayList<>();
        for (DataUnit dataUnit : assignment.get(lane)) {
          sources.add(pageSourceProvider.createPageSource(dataUnit, columns));
        }
        producers.add(
            pipeline.add(new TableScanSource(context(node, "scan", lane, false), sources)));
        log.debug("Scan lane {} of {} reads {}", lane, node.getId(), assignment.get(lane));
      }
      return new Lanes(schema, producers, false);
    }

    private Lanes values(PhysicalOperatorNode node) {
      checkChildCount(node, 0);
      List<Page> pages = node.getListParam(Params.PAGES, Page.class);
      PageSchema schema =
          node.getParam(
              Params.SCHEMA, PageSchema.class, pages.isEmpty() ? null : pages.get(0).getSchema());
      if (schema == null) {
        throw new PipelineConstructionException(
            "Node " + node.getId() + " has no pages and no schema");
      }
      int laneCount = Math.max(1, node.getParallelism());
      List<List<Page>> lanePages = new ArrayList<>(laneCount);
      for (int lane = 0; lane < laneCount; lane++) {
        lanePages.add(new ArrayList<>());
      }
      for (int i = 0; i < pages.size(); i++) {
        if (!pages.get(i).getSchema().equals(schema)) {
          throw new PipelineConstructionException(
              "Page " + i + " of " + node.getId() + " does not match schema " + schema);
        }
        lanePages.get(i % laneCount).add(pages.get(i));
      }
      List<Processor> producers = new ArrayList<>(laneCount);
      for (int lane = 0; lane < laneCount; lane++) {
        producers.add(
            pipeline.add(
                new ValuesSource(context(node, "values", lane, false), lanePages.get(lane))));
      }
      return new Lanes(schema, producers, false);
    }

    private Lanes unary(PhysicalOperatorNode node) {
      checkChildCount(node, 1);
      Lanes input = lanes(node.getChildren().get(0));
      int output = claim(node, input);
      if (node.getParallelism() != PhysicalOperatorNode.DEFAULT_PARALLELISM
          && node.getParallelism() != input.size()) {
        throw new PipelineConstructionException(
            "Node " + node.getId() + " declares " + node.getParallelism()
                + " lanes but its input has " + input.size());
      }
      PageSchema schema = null;
      List<Processor> producers = new ArrayList<>(input.size());
      for (int lane = 0; lane < input.size(); lane++) {
        Processor processor;
        switch (node.getOperatorType()) {
          case FILTER:
            processor =
                new FilterProcessor(
                    context(node, "filter", lane, false),
                    node.getParam(Params.PREDICATE, Expression.class));
            schema = input.schema;
            break;
          case PROJECT:
            List<Expression> expressions = node.getListParam(Params.EXPRESSIONS, Expression.class);
            List<String> names = node.getListParam(Params.NAMES, String.class);
            processor =
                new ProjectProcessor(context(node, "project", lane, false), expressions, names);
            schema = ((ProjectProcessor) processor).getOutputSchema();
            break;
          case AGGREGATE_PARTIAL:
            int[] groupChannels =
                node.getOptionalListParam(Params.GROUP_CHANNELS, Integer.class).stream()
                    .mapToInt(Integer::intValue)
                    .toArray();
            processor =
                new HashAggregateBuildProcessor(
                    context(node, "partial_agg", lane, false),
                    input.schema,
                    groupChannels,
                    node.getListParam(Params.CALLS, AggregateCall.class));
            schema = ((HashAggregateBuildProcessor) processor).getOutputSchema();
            break;
          case AGGREGATE_FINAL:
            processor =
                new HashAggregateFinalizeProcessor(
                    context(node, "final_agg", lane, false),
                    input.schema,
                    node.getParam(Params.GROUP_COUNT, Integer.class),
                    node.getListParam(Params.CALLS, AggregateCall.class));
            schema = ((HashAggregateFinalizeProcessor) processor).getOutputSchema();
            break;
          case SORT:
            List<SortKey> sortKeys = node.getListParam(Params.SORT_KEYS, SortKey.class);
            checkSortKeys(node, sortKeys, input.schema);
            processor =
                new SortProcessor(
                    context(node, "sort", lane, true), input.schema, new PageComparator(sortKeys));
            schema = input.schema;
            break;
          case LIMIT:
            processor =
                new LimitProcessor(
                    context(node, "limit", lane, false),
                    node.getParam(Params.LIMIT, Number.class).longValue(),
                    node.getParam(Params.OFFSET, Number.class, 0).longValue());
            schema = input.schema;
            break;
          default:
            throw new PipelineConstructionException(
                "Unsupported operator " + node.getOperatorType() + " at node " + node.getId());
        }
        pipeline.add(processor);
        pipeline.connect(input.producers.get(lane), output, processor, 0);
        producers.add(processor);
      }
      return new Lanes(schema, producers, false);
    }

    private Lanes merge(PhysicalOperatorNode node) {
      if (node.getChildren().isEmpty()) {
        throw new PipelineConstructionException("MERGE node " + node.getId() + " has no inputs");
      }
      List<Lanes> inputs = new ArrayList<>();
      List<Integer> outputs = new ArrayList<>();
      int laneCount = 0;
      for (PhysicalOperatorNode child : node.getChildren()) {
        Lanes input = lanes(child);
        outputs.add(claim(node, input));
        inputs.add(input);
        laneCount += input.size();
      }
      PageSchema schema = inputs.get(0).schema;
      for (Lanes input : inputs) {
        if (!types(input.schema).equals(types(schema))) {
          throw new PipelineConstructionException(
              "MERGE node " + node.getId() + " mixes schemas " + schema + " and " + input.schema);
        }
      }
      List<SortKey> sortKeys = node.getOptionalListParam(Params.SORT_KEYS, SortKey.class);
      Processor merge;
      if (sortKeys.isEmpty()) {
        merge = new UnionProcessor(context(node, "union", 0, false), laneCount);
      } else {
        checkSortKeys(node, sortKeys, schema);
        merge =
            new SortedMergeProcessor(
                context(node, "sorted_merge", 0, false),
                laneCount,
                schema,
                new PageComparator(sortKeys));
      }
      pipeline.add(merge);
      int inputIndex = 0;
      for (int i = 0; i < inputs.size(); i++) {
        for (Processor producer : inputs.get(i).producers) {
          pipeline.connect(producer, outputs.get(i), merge, inputIndex++);
        }
      }
      return new Lanes(schema, List.of(merge), false);
    }

    private Lanes exchange(PhysicalOperatorNode node) {
      checkChildCount(node, 1);
      Lanes input = lanes(node.getChildren().get(0));
      int output = claim(node, input);
      List<SortKey> sortKeys = node.getOptionalListParam(Params.SORT_KEYS, SortKey.class);
      PartitioningScheme scheme =
          PartitioningScheme.parse(
              node.getParam(Params.PARTITIONING, String.class),
              node.getOptionalListParam(Params.HASH_CHANNELS, Integer.class),
              sortKeys);
      boolean merging = scheme.getExchangeType() == ExchangeType.MERGE;
      int receivers =
          node.getParallelism() != PhysicalOperatorNode.DEFAULT_PARALLELISM
              ? node.getParallelism()
              : merging ? 1 : defaultParallelism();
      scheme.validate(receivers, input.schema.size());

      String exchangeId = pipeline.getPipelineId() + "/" + node.getId();
      ExchangeTransport transport =
          exchangeManager.createTransport(exchangeId, input.size(), receivers);
      pipeline.addExchangeId(exchangeId);
      for (int lane = 0; lane < input.size(); lane++) {
        ExchangeSinkProcessor sender =
            pipeline.add(
                new ExchangeSinkProcessor(
                    context(node, "exchange_send", lane, false),
                    transport,
                    lane,
                    scheme.createPartitioner(receivers)));
        pipeline.connect(input.producers.get(lane), output, sender, 0);
      }
      List<Processor> producers = new ArrayList<>(receivers);
      for (int lane = 0; lane < receivers; lane++) {
        ProcessorContext context = context(node, "exchange_receive", lane, false);
        producers.add(
            pipeline.add(
                merging
                    ? new MergingExchangeSourceProcessor(
                        context, transport, lane, input.schema, new PageComparator(sortKeys))
                    : new ExchangeSourceProcessor(context, transport, lane)));
      }
      log.debug(
          "Exchange {} routes {} lanes to {} by {}", exchangeId, input.size(), receivers, scheme);
      return new Lanes(input.schema, producers, false);
    }

    private Lanes result(PhysicalOperatorNode node) {
      checkChildCount(node, 1);
      Lanes input = lanes(node.getChildren().get(0));
      int output = claim(node, input);
      if (input.size() != 1) {
        throw new PipelineConstructionException(
            "RESULT node " + node.getId() + " needs exactly one input lane, got " + input.size());
      }
      ResultCollector collector = new ResultCollector(input.schema.getColumnNames());
      ResultSinkProcessor sink =
          pipeline.add(new ResultSinkProcessor(context(node, "result", 0, false), collector));
      pipeline.connect(input.producers.get(0), output, sink, 0);
      pipeline.setResultCollector(collector);
      return new Lanes(input.schema, List.of(), false);
    }

    private int claim(PhysicalOperatorNode node, Lanes input) {
      int output = input.claimOutput();
      if (output < 0) {
        throw new PipelineConstructionException(
            "Node " + node.getId() + " reads an input that is already consumed");
      }
      return output;
    }

    private ProcessorContext context(
        PhysicalOperatorNode node, String kind, int lane, boolean spills) {
      String name = String.format(Locale.ROOT, "%s[%s]#%d", kind, node.getId(), lane);
      boolean spillEnabled = settings.<Boolean>getSettingValue(Settings.Key.SORT_SPILL_ENABLED);
      return new ProcessorContext(
          name,
          node.getId(),
          lane,
          settings.<Long>getSettingValue(Settings.Key.PROCESSOR_MEMORY_LIMIT_BYTES),
          settings.<Integer>getSettingValue(Settings.Key.PAGE_SIZE_ROWS),
          spills && spillEnabled ? spillStore : null);
    }

    private int parallelism(PhysicalOperatorNode node) {
      return node.getParallelism() != PhysicalOperatorNode.DEFAULT_PARALLELISM
          ? node.getParallelism()
          : defaultParallelism();
    }

    private int defaultParallelism() {
      return Math.max(1, settings.<Integer>getSettingValue(Settings.Key.DEFAULT_PARALLELISM));
    }

    /** Releases what a failed build already created. */
    void abandon() {
      for (String exchangeId : pipeline.getExchangeIds()) {
        exchangeManager.release(exchangeId);
      }
      for (Processor processor : pipeline.getProcessors()) {
        try {
          processor.close();
        } catch (RuntimeException e) {
          log.warn("Error closing {} after failed construction", processor.getName(), e);
        }
      }
    }
  }

  private static void checkChildCount(PhysicalOperatorNode node, int expected) {
    if (node.getChildren().size() != expected) {
      throw new PipelineConstructionException(
          node.getOperatorType() + " node " + node.getId() + " needs " + expected
              + " inputs, got " + node.getChildren().size());
    }
  }

  private static void checkSortKeys(
      PhysicalOperatorNode node, List<SortKey> sortKeys, PageSchema schema) {
    if (sortKeys.isEmpty()) {
      throw new PipelineConstructionException("Node " + node.getId() + " has no sort keys");
    }
    for (SortKey key : sortKeys) {
      if (key.fieldIndex() < 0 || key.fieldIndex() >= schema.size()) {
        throw new PipelineConstructionException(
            "Sort key " + key.fieldName() + " of node " + node.getId() + " is out of range");
      }
    }
  }

  private static List<Object> types(PageSchema schema) {
    return schema.getColumns().stream().map(Column::getType).collect(Collectors.toList());
  }
}
