/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.physical;

import com.google.common.base.Preconditions;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import lombok.Getter;

/** A physical plan: the tree (or DAG) of operator nodes under a RESULT root. */
public class PhysicalPlan {

  @Getter private final PhysicalOperatorNode root;

  public PhysicalPlan(PhysicalOperatorNode root) {
    this.root = Preconditions.checkNotNull(root, "root");
  }

  /** Returns an indented description of the plan, each shared node printed once. */
  public String explain() {
    StringBuilder builder = new StringBuilder();
    explain(root, 0, builder, Collections.newSetFromMap(new IdentityHashMap<>()));
    return builder.toString();
  }

  private static void explain(
      PhysicalOperatorNode node, int depth, StringBuilder builder, Set<PhysicalOperatorNode> seen) {
    builder.append("  ".repeat(depth)).append(node.describe());
    if (!seen.add(node)) {
      builder.append(" (see above)\n");
      return;
    }
    builder.append('\n');
    for (PhysicalOperatorNode child : node.getChildren()) {
      explain(child, depth + 1, builder, seen);
    }
  }

  @Override
  public String toString() {
    return explain();
  }
}
