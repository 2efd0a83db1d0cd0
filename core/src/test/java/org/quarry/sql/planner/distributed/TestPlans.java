/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed;

import static org.quarry.sql.planner.distributed.expression.Expressions.column;
import static org.quarry.sql.planner.distributed.expression.Expressions.greaterThan;
import static org.quarry.sql.planner.distributed.expression.Expressions.literal;
import static org.quarry.sql.planner.distributed.expression.Expressions.modulus;

import java.util.ArrayList;
import java.util.List;
import org.quarry.sql.planner.distributed.aggregation.AggregateCall;
import org.quarry.sql.planner.distributed.aggregation.AggregateFunction;
import org.quarry.sql.planner.distributed.page.PageSchema;
import org.quarry.sql.planner.distributed.split.InMemoryPageSourceProvider;
import org.quarry.sql.planner.distributed.split.InMemoryTable;
import org.quarry.sql.planner.physical.PhysicalOperatorNode;
import org.quarry.sql.planner.physical.PhysicalPlan;
import org.quarry.sql.planner.physical.PhysicalPlans;

/** Tables and plans shared by the pipeline construction and query tests. */
public final class TestPlans {

  public static final PageSchema T_SCHEMA = TestPages.longSchema("x");

  private TestPlans() {}

  /** Table {@code t(x)} holding 1..10 in two data units. */
  public static InMemoryPageSourceProvider provider() {
    List<Object[]> rows = new ArrayList<>();
    for (long x = 1; x <= 10; x++) {
      rows.add(TestPages.row(x));
    }
    return new InMemoryPageSourceProvider()
        .register(InMemoryTable.fromRows("t", T_SCHEMA, rows, 2, 3));
  }

  /**
   * {@code SELECT x % 2 AS p, SUM(x) AS s FROM t WHERE x > 5 GROUP BY p}, scanned on two lanes and
   * shuffled on {@code p} to two aggregation lanes. Yields (0, 24) and (1, 21).
   */
  public static PhysicalPlan sumByParity() {
    PhysicalOperatorNode scan = PhysicalPlans.scan("scan", "t", List.of("x"), 2);
    PhysicalOperatorNode filter =
        PhysicalPlans.filter("filter", scan, greaterThan(column(T_SCHEMA, "x"), literal(5L)));
    PhysicalOperatorNode project =
        PhysicalPlans.project(
            "project",
            filter,
            List.of(column(T_SCHEMA, "x"), modulus(column(T_SCHEMA, "x"), literal(2L))),
            List.of("x", "p"));
    PhysicalOperatorNode shuffle = PhysicalPlans.hashExchange("shuffle", project, List.of(1), 2);
    PhysicalOperatorNode partial =
        PhysicalPlans.partialAggregate(
            "partial",
            shuffle,
            List.of(1),
            List.of(AggregateCall.of(AggregateFunction.SUM, 0, "s")));
    PhysicalOperatorNode fin =
        PhysicalPlans.finalAggregate(
            "final", partial, 1, List.of(AggregateCall.of(AggregateFunction.SUM, 0, "s")));
    return new PhysicalPlan(PhysicalPlans.result("result", PhysicalPlans.merge("gather", fin)));
  }
}
