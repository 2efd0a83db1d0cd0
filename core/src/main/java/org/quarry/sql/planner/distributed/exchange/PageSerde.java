/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.quarry.sql.exception.MalformedPageException;
import org.quarry.sql.planner.distributed.page.ArrayBlock;
import org.quarry.sql.planner.distributed.page.Block;
import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.Column;
import org.quarry.sql.planner.distributed.page.ColumnarPage;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageSchema;

/**
 * Encodes pages to bytes and back for exchange frames and spill files. The encoding is a Jackson
 * document holding the schema, the row count and one value array per column; binary values are
 * base64 encoded. Values are coerced back to their column type on decode, so numeric widths
 * survive the round trip. A value whose JSON kind does not fit its column type is rejected.
 */
public class PageSerde {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Serializes a page. */
  public byte[] serialize(Page page) {
    ObjectNode root = MAPPER.createObjectNode();
    ArrayNode columns = root.putArray("columns");
    for (Column column : page.getSchema().getColumns()) {
      columns
          .addObject()
          .put("name", column.getName())
          .put("type", column.getType().name())
          .put("nullable", column.isNullable());
    }
    root.put("rows", page.getPositionCount());
    ArrayNode blocks = root.putArray("blocks");
    for (int channel = 0; channel < page.getChannelCount(); channel++) {
      ArrayNode values = blocks.addArray();
      Block block = page.getBlock(channel);
      for (int position = 0; position < page.getPositionCount(); position++) {
        values.add(MAPPER.valueToTree(block.getValue(position)));
      }
    }
    try {
      return MAPPER.writeValueAsBytes(root);
    } catch (JsonProcessingException e) {
      throw new MalformedPageException("Cannot serialize page: " + e.getMessage(), e);
    }
  }

  /**
   * Deserializes a page.
   *
   * @throws MalformedPageException if the bytes are not a valid page encoding
   */
  public Page deserialize(byte[] bytes) {
    try {
      JsonNode root = MAPPER.readTree(bytes);
      if (root == null || !root.isObject()) {
        throw new MalformedPageException("Encoded page is not an object");
      }
      List<Column> columns = new ArrayList<>();
      for (JsonNode column : required(root, "columns")) {
        JsonNode nullable = required(column, "nullable");
        if (!nullable.isBoolean()) {
          throw new MalformedPageException("Invalid nullable flag: " + nullable);
        }
        columns.add(
            new Column(
                required(column, "name").asText(),
                BlockType.valueOf(required(column, "type").asText()),
                nullable.booleanValue()));
      }
      PageSchema schema = new PageSchema(columns);
      JsonNode rowCount = required(root, "rows");
      if (!rowCount.isIntegralNumber() || !rowCount.canConvertToInt() || rowCount.intValue() < 0) {
        throw new MalformedPageException("Invalid row count: " + rowCount);
      }
      int rows = rowCount.intValue();
      JsonNode blocks = required(root, "blocks");
      if (blocks.size() != columns.size()) {
        throw new MalformedPageException(
            "Encoded page has " + blocks.size() + " blocks for " + columns.size() + " columns");
      }
      if (columns.isEmpty()) {
        return ColumnarPage.rowCountOnly(rows);
      }
      List<Block> decoded = new ArrayList<>(columns.size());
      for (int channel = 0; channel < columns.size(); channel++) {
        Column column = columns.get(channel);
        JsonNode values = blocks.get(channel);
        if (values.size() != rows) {
          throw new MalformedPageException(
              "Column " + column.getName() + " has " + values.size() + " values, expected " + rows);
        }
        Object[] array = new Object[values.size()];
        for (int position = 0; position < array.length; position++) {
          array[position] = decodeValue(values.get(position), column.getType());
        }
        decoded.add(ArrayBlock.of(column.getType(), column.isNullable(), array));
      }
      return new ColumnarPage(schema, decoded);
    } catch (IOException | IllegalArgumentException e) {
      throw new MalformedPageException("Cannot deserialize page: " + e.getMessage(), e);
    }
  }

  private static JsonNode required(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null) {
      throw new MalformedPageException("Encoded page is missing field " + field);
    }
    return value;
  }

  private static Object decodeValue(JsonNode node, BlockType type) throws IOException {
    if (node == null || node.isNull()) {
      return null;
    }
    switch (type) {
      case BOOLEAN:
        check(node.isBoolean(), node, type);
        return node.booleanValue();
      case INT:
      case DATE:
        check(node.isIntegralNumber() && node.canConvertToInt(), node, type);
        return node.intValue();
      case LONG:
      case TIMESTAMP:
        check(node.isIntegralNumber() && node.canConvertToLong(), node, type);
        return node.longValue();
      case FLOAT:
        return node.isTextual() ? (float) nonFinite(node, type) : number(node, type).floatValue();
      case DOUBLE:
        return node.isTextual() ? nonFinite(node, type) : number(node, type).doubleValue();
      case BYTES:
        check(node.isBinary() || node.isTextual(), node, type);
        return node.binaryValue();
      default:
        check(node.isTextual(), node, type);
        return node.textValue();
    }
  }

  private static JsonNode number(JsonNode node, BlockType type) {
    check(node.isNumber(), node, type);
    return node;
  }

  /** Decodes the textual form Jackson writes for NaN and the infinities. */
  private static double nonFinite(JsonNode node, BlockType type) {
    switch (node.textValue()) {
      case "NaN":
        return Double.NaN;
      case "Infinity":
        return Double.POSITIVE_INFINITY;
      case "-Infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        throw new MalformedPageException("Invalid " + type + " value: " + node);
    }
  }

  private static void check(boolean valid, JsonNode node, BlockType type) {
    if (!valid) {
      throw new MalformedPageException("Invalid " + type + " value: " + node);
    }
  }
}
