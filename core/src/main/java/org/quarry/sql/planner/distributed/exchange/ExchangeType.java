/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

/** How rows are routed from exchange senders to receivers. */
public enum ExchangeType {
  /** Rows are routed by a hash of the key columns, so equal keys meet at one receiver. */
  HASH,

  /** Every page is sent to every receiver. */
  BROADCAST,

  /** Whole pages are dealt out to receivers in turn. */
  ROUND_ROBIN,

  /** All sorted sender streams flow to a single receiver, which merges them in order. */
  MERGE
}
