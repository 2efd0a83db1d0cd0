/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.quarry.sql.planner.distributed.page.Block;
import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.Page;

/** Reads one column of the input page. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ColumnReference implements Expression {

  private final int channel;
  private final String name;
  private final BlockType type;

  @Override
  public Object evaluate(Page page, int position) {
    if (channel >= page.getChannelCount()) {
      throw new ExpressionEvaluationException(
          "Column " + name + " (channel " + channel + ") missing from page " + page.getSchema());
    }
    Block block = page.getBlock(channel);
    if (block.getType() != type) {
      throw new ExpressionEvaluationException(
          "Column " + name + " expected " + type + " but page holds " + block.getType());
    }
    return block.getValue(position);
  }

  @Override
  public String toString() {
    return name;
  }
}
