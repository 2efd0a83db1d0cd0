/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.log4j.Log4j2;
import org.quarry.sql.exception.PipelineConstructionException;

/** Creates {@link LocalExchangeTransport}s with a fixed channel capacity. */
@Log4j2
public class LocalExchangeManager implements ExchangeManager {

  private final int channelCapacity;
  private final Map<String, LocalExchangeTransport> transports = new ConcurrentHashMap<>();

  public LocalExchangeManager(int channelCapacity) {
    this.channelCapacity = channelCapacity;
  }

  @Override
  public ExchangeTransport createTransport(String exchangeId, int senderCount, int receiverCount) {
    LocalExchangeTransport transport =
        new LocalExchangeTransport(exchangeId, senderCount, receiverCount, channelCapacity);
    if (transports.putIfAbsent(exchangeId, transport) != null) {
      throw new PipelineConstructionException("Duplicate exchange id " + exchangeId);
    }
    log.debug(
        "Created exchange {} with {} senders and {} receivers",
        exchangeId,
        senderCount,
        receiverCount);
    return transport;
  }

  @Override
  public void release(String exchangeId) {
    transports.remove(exchangeId);
  }

  /** Returns the number of live transports. */
  public int getTransportCount() {
    return transports.size();
  }
}
