/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.physical;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.quarry.sql.exception.PipelineConstructionException;

/**
 * A node of the physical plan handed to pipeline construction. Each node carries its operator
 * type, its input nodes, a declared degree of parallelism and operator-specific parameters.
 *
 * <p>A node may be the child of several parents. Plans are expected to be acyclic; pipeline
 * construction rejects cycles.
 */
public class PhysicalOperatorNode {

  /** Parameter names understood by pipeline construction. */
  public static final class Params {
    public static final String TABLE = "table";
    public static final String COLUMNS = "columns";
    public static final String PAGES = "pages";
    public static final String SCHEMA = "schema";
    public static final String PREDICATE = "predicate";
    public static final String EXPRESSIONS = "expressions";
    public static final String NAMES = "names";
    public static final String GROUP_CHANNELS = "group_channels";
    public static final String GROUP_COUNT = "group_count";
    public static final String CALLS = "calls";
    public static final String SORT_KEYS = "sort_keys";
    public static final String LIMIT = "limit";
    public static final String OFFSET = "offset";
    public static final String PARTITIONING = "partitioning";
    public static final String HASH_CHANNELS = "hash_channels";

    private Params() {}
  }

  /** Parallelism value asking for the configured default. */
  public static final int DEFAULT_PARALLELISM = 0;

  @Getter private final String id;
  @Getter private final PhysicalOperatorType operatorType;
  @Getter private final int parallelism;
  private final List<PhysicalOperatorNode> children = new ArrayList<>();
  private final Map<String, Object> params = new LinkedHashMap<>();

  public PhysicalOperatorNode(String id, PhysicalOperatorType operatorType, int parallelism) {
    Preconditions.checkNotNull(id, "id");
    Preconditions.checkNotNull(operatorType, "operatorType");
    Preconditions.checkArgument(parallelism >= 0, "parallelism must not be negative");
    this.id = id;
    this.operatorType = operatorType;
    this.parallelism = parallelism;
  }

  public PhysicalOperatorNode addChild(PhysicalOperatorNode child) {
    children.add(Preconditions.checkNotNull(child, "child"));
    return this;
  }

  public PhysicalOperatorNode withParam(String name, Object value) {
    params.put(name, value);
    return this;
  }

  public List<PhysicalOperatorNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public Map<String, Object> getParams() {
    return Collections.unmodifiableMap(params);
  }

  /**
   * Returns a required parameter.
   *
   * @throws PipelineConstructionException if it is missing or of the wrong type
   */
  public <T> T getParam(String name, Class<T> type) {
    Object value = params.get(name);
    if (value == null) {
      throw new PipelineConstructionException(
          "Node " + id + " (" + operatorType + ") is missing parameter " + name);
    }
    return cast(name, value, type);
  }

  /** Returns an optional parameter, or the default when it is absent. */
  public <T> T getParam(String name, Class<T> type, T defaultValue) {
    Object value = params.get(name);
    return value == null ? defaultValue : cast(name, value, type);
  }

  /** Returns a required list parameter whose elements are all of the given type. */
  public <T> List<T> getListParam(String name, Class<T> elementType) {
    return checkElements(name, getParam(name, List.class), elementType);
  }

  /** Returns an optional list parameter, or an empty list when it is absent. */
  public <T> List<T> getOptionalListParam(String name, Class<T> elementType) {
    return checkElements(name, getParam(name, List.class, List.of()), elementType);
  }

  @SuppressWarnings("unchecked")
  private <T> List<T> checkElements(String name, List<?> list, Class<T> elementType) {
    for (Object element : list) {
      if (!elementType.isInstance(element)) {
        throw new PipelineConstructionException(
            "Node " + id + " parameter " + name + " holds " + element + ", expected "
                + elementType.getSimpleName());
      }
    }
    return (List<T>) list;
  }

  private <T> T cast(String name, Object value, Class<T> type) {
    if (!type.isInstance(value)) {
      throw new PipelineConstructionException(
          "Node " + id + " parameter " + name + " is " + value.getClass().getSimpleName()
              + ", expected " + type.getSimpleName());
    }
    return type.cast(value);
  }

  /** Returns a one-line description of this node. */
  public String describe() {
    String lanes = parallelism > 0 ? " x" + parallelism : "";
    return operatorType + "[" + id + "]" + lanes + " " + params;
  }

  @Override
  public String toString() {
    return operatorType + "[" + id + "]";
  }
}
