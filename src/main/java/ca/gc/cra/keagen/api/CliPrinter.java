package ca.gc.cra.keagen.api;

import ca.gc.cra.keagen.application.port.DocumentSink;
import ca.gc.cra.keagen.infrastructure.json.KeaJsonWriter;
import ca.gc.cra.keagen.infrastructure.output.WriterDocumentSink;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Owns the CLI's stdout: usage text, dry-run plans and documents generated without {@code out=PATH}.
 *
 * <p>Logging goes to stderr (see {@code logback.xml}), so anything written here is either help text or a
 * complete Kea document that can be piped straight into a file.</p>
 */
public final class CliPrinter {
  /** Label reported by {@link DocumentSink#describe()} for stdout. */
  static final String STDOUT_LABEL = "stdout";

  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {}

  static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a block such as a dry-run plan, one line per element.
   *
   * @param lines lines to emit; {@code null} prints nothing
   */
  static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  /**
   * Returns a sink that serializes complete documents to stdout.
   *
   * @param json serializer carrying the requested pretty/compact layout
   * @return sink bound to the current stdout writer
   */
  static DocumentSink documentSink(KeaJsonWriter json) {
    return new WriterDocumentSink(writer(), json, STDOUT_LABEL);
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter active = override;
    return active != null ? active : STDOUT;
  }
}
