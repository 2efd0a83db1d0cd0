/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.dataunit;

import java.util.List;
import org.quarry.sql.planner.distributed.split.DataUnit;

/**
 * Assigns data units to the lanes of a scan. Implementations decide which lane reads each data
 * unit; every unit must be assigned to exactly one lane.
 */
public interface DataUnitAssignment {

  /**
   * Assigns data units to lanes.
   *
   * @param dataUnits the data units to assign
   * @param laneCount the number of scan lanes
   * @return one list of data units per lane, indexed by lane
   */
  List<List<DataUnit>> assign(List<DataUnit> dataUnits, int laneCount);
}
