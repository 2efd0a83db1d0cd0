/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.split;

import java.util.Map;

/**
 * A unit of data assigned to a scan lane. Each DataUnit represents a readable partition of a
 * table. Units of one table never overlap, so lanes given disjoint units read disjoint rows.
 *
 * <p>Subclasses provide storage-specific details.
 */
public abstract class DataUnit {

  /** Returns a unique identifier for this data unit. */
  public abstract String getDataUnitId();

  /** Returns the estimated number of rows in this data unit. */
  public abstract long getEstimatedRows();

  /** Returns the estimated size in bytes of this data unit. */
  public abstract long getEstimatedSizeBytes();

  /** Returns storage-specific properties for this data unit. */
  public abstract Map<String, String> getProperties();

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + getDataUnitId() + "}";
  }
}
