package ca.gc.cra.keagen.application.port;

import java.io.IOException;
import java.util.Map;

/**
 * <strong>What:</strong> Output port receiving a complete, rendered Kea document.
 * <p><strong>Why:</strong> Lets the generate use case hand its result to a file, stdout or a test double without
 * knowing how the document is serialized or stored.</p>
 * <p><strong>Role:</strong> Driven port on the output side; implemented under
 * {@code ca.gc.cra.keagen.infrastructure.output}.</p>
 * <p><strong>Thread-safety:</strong> Implementations are used from the single CLI thread.</p>
 *
 * @since 0.1.0
 */
public interface DocumentSink {
  /**
   * Persists the document.
   *
   * @param document complete rendered document, e.g. {@code {"Dhcp4": {...}}}
   * @throws IOException if the destination cannot be written
   */
  void write(Map<String, Object> document) throws IOException;

  /**
   * Describes the destination for logs and dry-run plans.
   *
   * @return destination label such as a file path or {@code <stdout>}
   */
  String describe();
}
