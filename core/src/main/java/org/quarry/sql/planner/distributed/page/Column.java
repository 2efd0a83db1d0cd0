/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.page;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.quarry.sql.planner.distributed.page.Block.BlockType;

/** Name, type and nullability of one page column. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class Column {

  private final String name;
  private final BlockType type;
  private final boolean nullable;

  public static Column of(String name, BlockType type) {
    return new Column(name, type, true);
  }

  public static Column notNull(String name, BlockType type) {
    return new Column(name, type, false);
  }

  @Override
  public String toString() {
    return name + ":" + type + (nullable ? "" : " NOT NULL");
  }
}
