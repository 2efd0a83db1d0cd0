/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.split;

import com.google.common.util.concurrent.ListenableFuture;
import org.quarry.sql.planner.distributed.page.Page;

/** Reads the pages of one data unit. Implementations are driven by one thread at a time. */
public interface PageSource extends AutoCloseable {

  /** Returns the next page, or null if none is available right now. Must not block. */
  Page getNextPage();

  /** Returns true once every page has been returned. */
  boolean isFinished();

  /**
   * Returns a future that completes when {@link #getNextPage()} can make progress, such as when an
   * outstanding read returns. An already completed future means the source is not blocked.
   */
  ListenableFuture<?> isBlocked();

  /** Returns the number of bytes read so far. */
  long getCompletedBytes();

  @Override
  void close();
}
