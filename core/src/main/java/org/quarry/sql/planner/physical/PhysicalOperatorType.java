/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.physical;

/** Operator types of physical plan nodes, each mapped to one kind of runtime processor. */
public enum PhysicalOperatorType {
  /** Table scan; one lane per degree of parallelism, fed disjoint data units. */
  SCAN,

  /** Fixed in-memory pages. */
  VALUES,

  FILTER,
  PROJECT,

  /** First step of a two-step aggregation: per-lane partial state. */
  AGGREGATE_PARTIAL,

  /** Second step of a two-step aggregation: combines partial state into final values. */
  AGGREGATE_FINAL,

  SORT,
  LIMIT,

  /** Collapses every lane of every child into one, optionally preserving sort order. */
  MERGE,

  /** Repartitions lanes through an exchange transport. */
  EXCHANGE,

  /** Delivers the single remaining lane to the query result. */
  RESULT
}
