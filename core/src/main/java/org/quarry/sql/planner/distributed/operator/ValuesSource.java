/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.operator;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.processor.ProcessorContext;
import org.quarry.sql.planner.distributed.processor.SourceProcessor;

/** Emits a fixed list of pages. */
public class ValuesSource extends SourceProcessor {

  private final List<Page> pages;
  private int next;

  public ValuesSource(ProcessorContext context, List<Page> pages) {
    super(context);
    this.pages = ImmutableList.copyOf(pages);
  }

  @Override
  protected Page generate() {
    return next < pages.size() ? pages.get(next++) : null;
  }

  @Override
  protected boolean isExhausted() {
    return next >= pages.size();
  }
}
