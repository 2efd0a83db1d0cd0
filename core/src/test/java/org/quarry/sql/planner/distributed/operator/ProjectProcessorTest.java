/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.quarry.sql.planner.distributed.TestPages.row;
import static org.quarry.sql.planner.distributed.expression.Expressions.column;
import static org.quarry.sql.planner.distributed.expression.Expressions.divide;
import static org.quarry.sql.planner.distributed.expression.Expressions.literal;
import static org.quarry.sql.planner.distributed.expression.Expressions.modulus;

import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.quarry.sql.planner.distributed.TestPages;
import org.quarry.sql.planner.distributed.executor.WorkerPool;
import org.quarry.sql.planner.distributed.expression.ExpressionEvaluationException;
import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.PageSchema;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ProjectProcessorTest {

  private static WorkerPool pool;

  private final PageSchema schema = TestPages.longSchema("x");

  @BeforeAll
  static void startPool() {
    pool = new WorkerPool(2, 16);
  }

  @AfterAll
  static void stopPool() {
    pool.close();
  }

  @Test
  void should_evaluate_one_expression_per_column() {
    // Given
    ProjectProcessor project =
        new ProjectProcessor(
            TestPages.context("project"),
            List.of(column(schema, "x"), modulus(column(schema, "x"), literal(2L)), literal("k")),
            List.of("x", "p", "tag"));

    // When
    ResultCollector result =
        TestPages.runThrough(
            pool, project, project.getOutputSchema(), List.of(TestPages.sequence(schema, 1, 3)));

    // Then
    assertEquals(
        List.of(List.of(1L, 1L, "k"), List.of(2L, 0L, "k"), List.of(3L, 1L, "k")),
        result.getRows());
    assertEquals(List.of("x", "p", "tag"), result.getFieldNames());
  }

  @Test
  void should_derive_output_schema_from_expressions() {
    PageSchema output =
        ProjectProcessor.outputSchema(
            List.of(column(schema, "x"), literal(1.5)), List.of("a", "b"));

    assertEquals(BlockType.LONG, output.getColumn(0).getType());
    assertTrue(output.getColumn(0).isNullable());
    assertEquals(BlockType.DOUBLE, output.getColumn(1).getType());
    assertFalse(output.getColumn(1).isNullable());
  }

  @Test
  void should_reject_mismatched_names() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ProjectProcessor.outputSchema(List.of(column(schema, "x")), List.of()));
  }

  @Test
  void should_fail_query_on_evaluation_error() {
    ProjectProcessor project =
        new ProjectProcessor(
            TestPages.context("project"),
            List.of(divide(column(schema, "x"), literal(0L))),
            List.of("q"));

    assertThrows(
        ExpressionEvaluationException.class,
        () ->
            TestPages.runThrough(
                pool,
                project,
                project.getOutputSchema(),
                List.of(TestPages.sequence(schema, 1, 3))));
  }
}
