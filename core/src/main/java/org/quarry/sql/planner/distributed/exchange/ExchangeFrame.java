/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import com.google.common.base.Preconditions;
import lombok.Getter;

/** One message on an exchange channel: a serialized page, or the end of a sender's stream. */
@Getter
public final class ExchangeFrame {

  /** Frame kinds. */
  public enum Kind {
    DATA,
    END
  }

  private final int sourceId;
  private final int destinationId;
  private final Kind kind;
  private final byte[] payload;

  private ExchangeFrame(int sourceId, int destinationId, Kind kind, byte[] payload) {
    this.sourceId = sourceId;
    this.destinationId = destinationId;
    this.kind = kind;
    this.payload = payload;
  }

  public static ExchangeFrame data(int sourceId, int destinationId, byte[] payload) {
    Preconditions.checkNotNull(payload, "payload");
    return new ExchangeFrame(sourceId, destinationId, Kind.DATA, payload);
  }

  public static ExchangeFrame end(int sourceId, int destinationId) {
    return new ExchangeFrame(sourceId, destinationId, Kind.END, new byte[0]);
  }

  public boolean isEnd() {
    return kind == Kind.END;
  }

  @Override
  public String toString() {
    return kind + "{" + sourceId + "->" + destinationId + ", " + payload.length + " bytes}";
  }
}
