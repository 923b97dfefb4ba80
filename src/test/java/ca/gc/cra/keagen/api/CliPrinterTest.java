package ca.gc.cra.keagen.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.keagen.application.port.DocumentSink;
import ca.gc.cra.keagen.infrastructure.json.KeaJsonWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CliPrinterTest {

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void documentSinkWritesToStdoutWriter() throws IOException {
    StringWriter buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));

    DocumentSink sink = CliPrinter.documentSink(new KeaJsonWriter(false));
    sink.write(Map.of("valid-lifetime", 60L));

    assertEquals("stdout", sink.describe());
    assertEquals("{\"valid-lifetime\":60}\n", buffer.toString());
  }

  @Test
  void printLinesIgnoresNull() {
    StringWriter buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));

    CliPrinter.printLines((String[]) null);
    CliPrinter.printLines("a", "b");

    assertEquals("a" + System.lineSeparator() + "b" + System.lineSeparator(), buffer.toString());
  }
}
