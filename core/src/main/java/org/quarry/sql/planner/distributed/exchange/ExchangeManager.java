/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

/**
 * Manages the lifecycle of exchanges between lanes of a query. Creates one transport per exchange
 * id, shared by that exchange's sender and receiver processors.
 */
public interface ExchangeManager {

  /**
   * Creates the transport of an exchange.
   *
   * @param exchangeId unique id of the exchange within the query
   * @param senderCount number of sending lanes
   * @param receiverCount number of receiving lanes
   * @return the transport
   */
  ExchangeTransport createTransport(String exchangeId, int senderCount, int receiverCount);

  /** Releases the transport of an exchange. Unknown ids are ignored. */
  void release(String exchangeId);
}
