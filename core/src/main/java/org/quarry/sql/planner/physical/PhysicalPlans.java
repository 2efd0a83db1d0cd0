/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.physical;

import java.util.List;
import lombok.experimental.UtilityClass;
import org.quarry.sql.planner.distributed.aggregation.AggregateCall;
import org.quarry.sql.planner.distributed.expression.Expression;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageSchema;
import org.quarry.sql.planner.distributed.sort.SortKey;
import org.quarry.sql.planner.physical.PhysicalOperatorNode.Params;

/** Factory methods for plan nodes with the parameters pipeline construction expects. */
@UtilityClass
public class PhysicalPlans {

  public static PhysicalOperatorNode scan(
      String id, String table, List<String> columns, int parallelism) {
    return new PhysicalOperatorNode(id, PhysicalOperatorType.SCAN, parallelism)
        .withParam(Params.TABLE, table)
        .withParam(Params.COLUMNS, columns);
  }

  public static PhysicalOperatorNode values(String id, PageSchema schema, List<Page> pages) {
    return new PhysicalOperatorNode(id, PhysicalOperatorType.VALUES, 1)
        .withParam(Params.SCHEMA, schema)
        .withParam(Params.PAGES, pages);
  }

  public static PhysicalOperatorNode filter(
      String id, PhysicalOperatorNode child, Expression predicate) {
    return unary(id, PhysicalOperatorType.FILTER, child).withParam(Params.PREDICATE, predicate);
  }

  public static PhysicalOperatorNode project(
      String id, PhysicalOperatorNode child, List<Expression> expressions, List<String> names) {
    return unary(id, PhysicalOperatorType.PROJECT, child)
        .withParam(Params.EXPRESSIONS, expressions)
        .withParam(Params.NAMES, names);
  }

  public static PhysicalOperatorNode partialAggregate(
      String id,
      PhysicalOperatorNode child,
      List<Integer> groupChannels,
      List<AggregateCall> calls) {
    return unary(id, PhysicalOperatorType.AGGREGATE_PARTIAL, child)
        .withParam(Params.GROUP_CHANNELS, groupChannels)
        .withParam(Params.CALLS, calls);
  }

  public static PhysicalOperatorNode finalAggregate(
      String id, PhysicalOperatorNode child, int groupCount, List<AggregateCall> calls) {
    return unary(id, PhysicalOperatorType.AGGREGATE_FINAL, child)
        .withParam(Params.GROUP_COUNT, groupCount)
        .withParam(Params.CALLS, calls);
  }

  public static PhysicalOperatorNode sort(
      String id, PhysicalOperatorNode child, List<SortKey> sortKeys) {
    return unary(id, PhysicalOperatorType.SORT, child).withParam(Params.SORT_KEYS, sortKeys);
  }

  public static PhysicalOperatorNode limit(
      String id, PhysicalOperatorNode child, long limit, long offset) {
    return unary(id, PhysicalOperatorType.LIMIT, child)
        .withParam(Params.LIMIT, limit)
        .withParam(Params.OFFSET, offset);
  }

  /** Unordered merge of every lane of every child. */
  public static PhysicalOperatorNode merge(String id, PhysicalOperatorNode... children) {
    PhysicalOperatorNode node = new PhysicalOperatorNode(id, PhysicalOperatorType.MERGE, 1);
    for (PhysicalOperatorNode child : children) {
      node.addChild(child);
    }
    return node;
  }

  /** Order-preserving merge of lanes that are each sorted by the keys. */
  public static PhysicalOperatorNode sortedMerge(
      String id, List<SortKey> sortKeys, PhysicalOperatorNode... children) {
    return merge(id, children).withParam(Params.SORT_KEYS, sortKeys);
  }

  public static PhysicalOperatorNode hashExchange(
      String id, PhysicalOperatorNode child, List<Integer> hashChannels, int destinations) {
    return exchange(id, child, "hash", destinations).withParam(Params.HASH_CHANNELS, hashChannels);
  }

  public static PhysicalOperatorNode exchange(
      String id, PhysicalOperatorNode child, String partitioning, int destinations) {
    return new PhysicalOperatorNode(id, PhysicalOperatorType.EXCHANGE, destinations)
        .addChild(child)
        .withParam(Params.PARTITIONING, partitioning);
  }

  public static PhysicalOperatorNode mergeExchange(
      String id, PhysicalOperatorNode child, List<SortKey> sortKeys) {
    return exchange(id, child, "merge", 1).withParam(Params.SORT_KEYS, sortKeys);
  }

  public static PhysicalOperatorNode result(String id, PhysicalOperatorNode child) {
    return new PhysicalOperatorNode(id, PhysicalOperatorType.RESULT, 1).addChild(child);
  }

  private static PhysicalOperatorNode unary(
      String id, PhysicalOperatorType type, PhysicalOperatorNode child) {
    return new PhysicalOperatorNode(id, type, PhysicalOperatorNode.DEFAULT_PARALLELISM)
        .addChild(child);
  }
}
