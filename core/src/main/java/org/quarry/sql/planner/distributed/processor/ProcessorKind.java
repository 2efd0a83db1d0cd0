/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.processor;

/** Closed set of processor roles. The scheduler does not depend on the kind. */
public enum ProcessorKind {
  SOURCE,
  TRANSFORM,
  SINK,
  EXCHANGE_SEND,
  EXCHANGE_RECEIVE
}
