/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.aggregation;

import java.util.List;
import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.Values;

/** Supported aggregate functions. */
public enum AggregateFunction {
  SUM,
  COUNT,
  MIN,
  MAX,
  AVG;

  /**
   * Checks the function applies to the input type.
   *
   * @throws IllegalArgumentException for SUM or AVG over a non-numeric column
   */
  public void validate(BlockType inputType) {
    if ((this == SUM || this == AVG) && !inputType.isNumeric()) {
      throw new IllegalArgumentException(name() + " is not defined for " + inputType);
    }
  }

  public BlockType getOutputType(BlockType inputType) {
    switch (this) {
      case COUNT:
        return BlockType.LONG;
      case AVG:
        return BlockType.DOUBLE;
      case SUM:
        return isFloating(inputType) ? BlockType.DOUBLE : BlockType.LONG;
      default:
        return inputType;
    }
  }

  /** Returns true if the final value may be null, which happens for empty groups. */
  public boolean isOutputNullable() {
    return this != COUNT;
  }

  /** Returns the types of the intermediate values the partial step emits. */
  public List<BlockType> getIntermediateTypes(BlockType inputType) {
    if (this == AVG) {
      return List.of(BlockType.DOUBLE, BlockType.LONG);
    }
    return List.of(getOutputType(inputType));
  }

  /**
   * Creates an empty accumulator. The final step passes the first intermediate type, which maps to
   * the same accumulator as the original input type.
   */
  public Accumulator createAccumulator(BlockType inputType) {
    switch (this) {
      case SUM:
        return isFloating(inputType) ? new DoubleSum() : new LongSum();
      case COUNT:
        return new Count();
      case MIN:
        return new MinMax(false);
      case MAX:
        return new MinMax(true);
      default:
        return new Average();
    }
  }

  private static boolean isFloating(BlockType type) {
    return type == BlockType.DOUBLE || type == BlockType.FLOAT;
  }

  private static final class LongSum implements Accumulator {
    private long sum;
    private boolean seen;

    @Override
    public void addInput(Object value) {
      if (value != null) {
        sum = Math.addExact(sum, ((Number) value).longValue());
        seen = true;
      }
    }

    @Override
    public void addIntermediate(Object[] row, int offset) {
      addInput(row[offset]);
    }

    @Override
    public void writeIntermediate(Object[] row, int offset) {
      row[offset] = evaluateFinal();
    }

    @Override
    public Object evaluateFinal() {
      return seen ? sum : null;
    }
  }

  private static final class DoubleSum implements Accumulator {
    private double sum;
    private boolean seen;

    @Override
    public void addInput(Object value) {
      if (value != null) {
        sum += ((Number) value).doubleValue();
        seen = true;
      }
    }

    @Override
    public void addIntermediate(Object[] row, int offset) {
      addInput(row[offset]);
    }

    @Override
    public void writeIntermediate(Object[] row, int offset) {
      row[offset] = evaluateFinal();
    }

    @Override
    public Object evaluateFinal() {
      return seen ? sum : null;
    }
  }

  private static final class Count implements Accumulator {
    private long count;

    @Override
    public void addInput(Object value) {
      if (value != null) {
        count++;
      }
    }

    @Override
    public void addIntermediate(Object[] row, int offset) {
      count += (Long) row[offset];
    }

    @Override
    public void writeIntermediate(Object[] row, int offset) {
      row[offset] = count;
    }

    @Override
    public Object evaluateFinal() {
      return count;
    }
  }

  private static final class MinMax implements Accumulator {
    private final boolean max;
    private Object current;

    MinMax(boolean max) {
      this.max = max;
    }

    @Override
    public void addInput(Object value) {
      if (value == null) {
        return;
      }
      if (current == null) {
        current = value;
        return;
      }
      int comparison = Values.compare(value, current);
      if (max ? comparison > 0 : comparison < 0) {
        current = value;
      }
    }

    @Override
    public void addIntermediate(Object[] row, int offset) {
      addInput(row[offset]);
    }

    @Override
    public void writeIntermediate(Object[] row, int offset) {
      row[offset] = current;
    }

    @Override
    public Object evaluateFinal() {
      return current;
    }
  }

  private static final class Average implements Accumulator {
    private double sum;
    private long count;

    @Override
    public void addInput(Object value) {
      if (value != null) {
        sum += ((Number) value).doubleValue();
        count++;
      }
    }

    @Override
    public void addIntermediate(Object[] row, int offset) {
      sum += (Double) row[offset];
      count += (Long) row[offset + 1];
    }

    @Override
    public void writeIntermediate(Object[] row, int offset) {
      row[offset] = sum;
      row[offset + 1] = count;
    }

    @Override
    public Object evaluateFinal() {
      return count == 0 ? null : sum / count;
    }
  }
}
