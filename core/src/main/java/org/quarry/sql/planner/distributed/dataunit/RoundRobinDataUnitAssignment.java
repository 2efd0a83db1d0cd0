/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.dataunit;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import org.quarry.sql.planner.distributed.split.DataUnit;

/** Deals data units out to lanes in order: unit i goes to lane i mod laneCount. */
public class RoundRobinDataUnitAssignment implements DataUnitAssignment {

  @Override
  public List<List<DataUnit>> assign(List<DataUnit> dataUnits, int laneCount) {
    Preconditions.checkArgument(laneCount > 0, "laneCount must be positive");
    List<List<DataUnit>> lanes = new ArrayList<>(laneCount);
    for (int lane = 0; lane < laneCount; lane++) {
      lanes.add(new ArrayList<>());
    }
    for (int i = 0; i < dataUnits.size(); i++) {
      lanes.get(i % laneCount).add(dataUnits.get(i));
    }
    return lanes;
  }
}
