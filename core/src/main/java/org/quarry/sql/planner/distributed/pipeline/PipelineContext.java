/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;
import org.quarry.sql.exception.QueryCancelledException;

/** Runtime state for a pipeline execution. Tracks status and provides cancellation. */
public class PipelineContext {

  /** Pipeline execution status. */
  public enum Status {
    CREATED,
    RUNNING,
    FINISHED,
    FAILED,
    CANCELLED
  }

  private final String pipelineId;
  private volatile Status status;
  private final AtomicBoolean cancelled;
  private volatile QueryCancelledException.Reason cancelReason;
  private volatile String failureMessage;

  public PipelineContext(String pipelineId) {
    this.pipelineId = pipelineId;
    this.status = Status.CREATED;
    this.cancelled = new AtomicBoolean(false);
  }

  public String getPipelineId() {
    return pipelineId;
  }

  public Status getStatus() {
    return status;
  }

  public void setRunning() {
    this.status = Status.RUNNING;
  }

  public void setFinished() {
    this.status = Status.FINISHED;
  }

  public void setFailed(String message) {
    this.status = Status.FAILED;
    this.failureMessage = message;
  }

  public void setCancelled() {
    this.status = Status.CANCELLED;
  }

  /**
   * Requests cancellation. Returns true for the first request only; the reason of the first
   * request is kept.
   */
  public boolean requestCancel(QueryCancelledException.Reason reason) {
    if (cancelled.compareAndSet(false, true)) {
      cancelReason = reason;
      return true;
    }
    return false;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** Returns the reason of the cancellation request, or null if none was made. */
  public QueryCancelledException.Reason getCancelReason() {
    return cancelReason;
  }

  public String getFailureMessage() {
    return failureMessage;
  }
}
