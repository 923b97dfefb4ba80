package ca.gc.cra.keagen.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;

/**
 * Streams rendered Kea documents (maps, lists and scalars) as JSON, preserving map key order.
 *
 * <p>Pretty output indents objects and arrays by two spaces, one element per line, and writes
 * {@code "key": value} with no space before the colon.</p>
 *
 * @since 0.1.0
 */
public final class KeaJsonWriter {
  private static final String INDENT = "  ";

  private final JsonFactory factory = new JsonFactory();
  private final boolean pretty;

  /**
   * Creates a writer.
   *
   * @param pretty {@code true} for indented multi-line output, {@code false} for a single line
   */
  public KeaJsonWriter(boolean pretty) {
    this.pretty = pretty;
  }

  public boolean pretty() {
    return pretty;
  }

  /**
   * Writes {@code document} to {@code out}. The writer is flushed but not closed.
   *
   * @param document rendered document
   * @param out destination
   * @throws IOException if the destination fails
   * @throws IllegalArgumentException if the document holds a value JSON cannot represent
   */
  public void write(Map<String, Object> document, Writer out) throws IOException {
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(out, "out");
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      if (pretty) {
        DefaultIndenter indenter = new DefaultIndenter(INDENT, "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter().withSeparators(
            Separators.createDefaultInstance().withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        gen.setPrettyPrinter(printer);
      }
      writeValue(gen, document);
    }
    out.flush();
  }

  /**
   * Serializes {@code document} into a string.
   *
   * @param document rendered document
   * @return JSON text without trailing newline
   */
  public String toJson(Map<String, Object> document) {
    StringWriter buffer = new StringWriter(512);
    try {
      write(document, buffer);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize document", ex);
    }
    return buffer.toString();
  }

  private void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else if (value instanceof String text) {
      gen.writeString(text);
    } else if (value instanceof Boolean flag) {
      gen.writeBoolean(flag);
    } else if (value instanceof Long number) {
      gen.writeNumber(number);
    } else if (value instanceof Integer number) {
      gen.writeNumber(number);
    } else if (value instanceof BigInteger number) {
      gen.writeNumber(number);
    } else if (value instanceof BigDecimal number) {
      gen.writeNumber(number);
    } else {
      throw new IllegalArgumentException("Unsupported document value type: " + value.getClass().getName());
    }
  }
}
