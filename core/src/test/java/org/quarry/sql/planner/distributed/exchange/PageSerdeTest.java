/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.quarry.sql.exception.MalformedPageException;
import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.Column;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageBuilder;
import org.quarry.sql.planner.distributed.page.PageSchema;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PageSerdeTest {

  private final PageSerde serde = new PageSerde();

  @Test
  void should_preserve_types_and_nulls() {
    PageSchema schema =
        PageSchema.of(
            Column.notNull("id", BlockType.INT),
            Column.of("total", BlockType.LONG),
            Column.of("ratio", BlockType.DOUBLE),
            Column.of("name", BlockType.STRING),
            Column.of("raw", BlockType.BYTES),
            Column.of("flag", BlockType.BOOLEAN));
    PageBuilder builder = new PageBuilder(schema);
    builder.appendRow(1, 10L, Double.NaN, "a", new byte[] {1, 2}, true);
    builder.appendRow(2, null, 0.5d, null, null, null);
    Page page = builder.build();

    Page decoded = serde.deserialize(serde.serialize(page));

    assertEquals(schema, decoded.getSchema());
    assertEquals(2, decoded.getPositionCount());
    assertEquals(1, decoded.getValue(0, 0));
    assertEquals(10L, decoded.getValue(0, 1));
    assertEquals(Double.NaN, decoded.getValue(0, 2));
    assertEquals("a", decoded.getValue(0, 3));
    assertArrayEquals(new byte[] {1, 2}, (byte[]) decoded.getValue(0, 4));
    assertEquals(true, decoded.getValue(0, 5));
    assertNull(decoded.getValue(1, 1));
    assertNull(decoded.getValue(1, 4));
  }

  @Test
  void should_reject_bytes_that_are_not_a_page() {
    assertThrows(
        MalformedPageException.class,
        () -> serde.deserialize("not a page".getBytes(StandardCharsets.UTF_8)));
    assertThrows(
        MalformedPageException.class,
        () -> serde.deserialize("[1,2]".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void should_reject_value_count_not_matching_row_count() {
    String json =
        "{\"columns\":[{\"name\":\"x\",\"type\":\"LONG\",\"nullable\":true}],"
            + "\"rows\":2,\"blocks\":[[1]]}";

    assertThrows(
        MalformedPageException.class,
        () -> serde.deserialize(json.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void should_reject_unknown_column_type() {
    String json =
        "{\"columns\":[{\"name\":\"x\",\"type\":\"DECIMAL\",\"nullable\":true}],"
            + "\"rows\":0,\"blocks\":[[]]}";

    assertThrows(
        MalformedPageException.class,
        () -> serde.deserialize(json.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void should_reject_values_not_fitting_their_column_type() {
    assertMalformed("LONG", "\"oops\"");
    assertMalformed("LONG", "1.5");
    assertMalformed("INT", "4294967296");
    assertMalformed("BOOLEAN", "\"yes\"");
    assertMalformed("BOOLEAN", "1");
    assertMalformed("STRING", "7");
    assertMalformed("DOUBLE", "\"1.5\"");
    assertMalformed("DOUBLE", "true");
    assertMalformed("BYTES", "12");
  }

  @Test
  void should_reject_invalid_row_count() {
    String json =
        "{\"columns\":[{\"name\":\"x\",\"type\":\"LONG\",\"nullable\":true}],"
            + "\"rows\":\"one\",\"blocks\":[[1]]}";

    assertThrows(
        MalformedPageException.class,
        () -> serde.deserialize(json.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void should_decode_non_finite_doubles_written_as_text() {
    Page decoded = serde.deserialize(encoded("DOUBLE", "\"-Infinity\""));

    assertEquals(Double.NEGATIVE_INFINITY, decoded.getValue(0, 0));
  }

  private void assertMalformed(String type, String value) {
    byte[] bytes = encoded(type, value);
    assertThrows(MalformedPageException.class, () -> serde.deserialize(bytes), value);
  }

  private static byte[] encoded(String type, String value) {
    String json =
        "{\"columns\":[{\"name\":\"x\",\"type\":\""
            + type
            + "\",\"nullable\":true}],\"rows\":1,\"blocks\":[["
            + value
            + "]]}";
    return json.getBytes(StandardCharsets.UTF_8);
  }
}
