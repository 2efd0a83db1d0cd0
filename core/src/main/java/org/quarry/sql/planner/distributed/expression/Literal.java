/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.expression;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.Page;

/** A constant. */
@Getter
@EqualsAndHashCode
public class Literal implements Expression {

  private final Object value;
  private final BlockType type;

  public Literal(Object value, BlockType type) {
    Preconditions.checkArgument(
        type.accepts(value), "Literal %s is not of type %s", value, type);
    this.value = value;
    this.type = type;
  }

  @Override
  public Object evaluate(Page page, int position) {
    return value;
  }

  @Override
  public boolean isNullable() {
    return value == null;
  }

  @Override
  public String toString() {
    return value instanceof String ? "'" + value + "'" : String.valueOf(value);
  }
}
