package ca.gc.cra.keagen.infrastructure.output;

import ca.gc.cra.keagen.application.port.DocumentSink;
import ca.gc.cra.keagen.infrastructure.json.KeaJsonWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.Objects;

/**
 * Prints the rendered document to a character stream, typically stdout.
 *
 * @since 0.1.0
 */
public final class WriterDocumentSink implements DocumentSink {
  private final PrintWriter out;
  private final KeaJsonWriter writer;
  private final String label;

  /**
   * Creates a sink over an open writer; the writer is flushed after each document but never closed.
   *
   * @param out destination writer
   * @param writer JSON serializer
   * @param label destination description, e.g. {@code <stdout>}
   */
  public WriterDocumentSink(PrintWriter out, KeaJsonWriter writer, String label) {
    this.out = Objects.requireNonNull(out, "out");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.label = Objects.requireNonNull(label, "label");
  }

  @Override
  public void write(Map<String, Object> document) throws IOException {
    writer.write(document, out);
    out.print('\n');
    out.flush();
    if (out.checkError()) {
      throw new IOException("Failed to write Kea configuration to " + label);
    }
  }

  @Override
  public String describe() {
    return label;
  }
}
