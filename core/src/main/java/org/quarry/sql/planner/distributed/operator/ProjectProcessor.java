/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.operator;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.quarry.sql.planner.distributed.expression.ColumnReference;
import org.quarry.sql.planner.distributed.expression.Expression;
import org.quarry.sql.planner.distributed.page.ArrayBlock;
import org.quarry.sql.planner.distributed.page.Block;
import org.quarry.sql.planner.distributed.page.Column;
import org.quarry.sql.planner.distributed.page.ColumnarPage;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageSchema;
import org.quarry.sql.planner.distributed.processor.ProcessorContext;
import org.quarry.sql.planner.distributed.processor.TransformProcessor;

/**
 * Evaluates one expression per output column. Plain column references pass the input block
 * through without copying.
 */
public class ProjectProcessor extends TransformProcessor {

  private final List<Expression> expressions;
  private final PageSchema outputSchema;

  public ProjectProcessor(
      ProcessorContext context, List<Expression> expressions, List<String> outputNames) {
    super(context);
    this.expressions = ImmutableList.copyOf(expressions);
    this.outputSchema = outputSchema(expressions, outputNames);
  }

  /** Returns the schema produced by projecting the expressions under the given names. */
  public static PageSchema outputSchema(List<Expression> expressions, List<String> outputNames) {
    Preconditions.checkArgument(
        expressions.size() == outputNames.size(),
        "%s expressions but %s output names",
        expressions.size(),
        outputNames.size());
    List<Column> columns = new ArrayList<>(expressions.size());
    for (int i = 0; i < expressions.size(); i++) {
      Expression expression = expressions.get(i);
      columns.add(new Column(outputNames.get(i), expression.getType(), expression.isNullable()));
    }
    return new PageSchema(columns);
  }

  public PageSchema getOutputSchema() {
    return outputSchema;
  }

  @Override
  protected Page process(Page page) {
    List<Block> blocks = new ArrayList<>(expressions.size());
    for (Expression expression : expressions) {
      if (expression instanceof ColumnReference) {
        int channel = ((ColumnReference) expression).getChannel();
        if (channel < page.getChannelCount()
            && page.getBlock(channel).getType() == expression.getType()) {
          blocks.add(page.getBlock(channel));
          continue;
        }
      }
      Object[] values = new Object[page.getPositionCount()];
      for (int position = 0; position < values.length; position++) {
        values[position] = expression.evaluate(page, position);
      }
      blocks.add(ArrayBlock.of(expression.getType(), expression.isNullable(), values));
    }
    return new ColumnarPage(outputSchema, blocks);
  }
}
