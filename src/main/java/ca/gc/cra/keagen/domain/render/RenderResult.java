package ca.gc.cra.keagen.domain.render;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of rendering a configuration: the document built so far plus the diagnostic that stopped it.
 *
 * <p>A result with a diagnostic carries a partial document that must not be handed to Kea.</p>
 *
 * @param document rendered document in key order; never {@code null}
 * @param diagnostic reason rendering stopped early; empty when the document is complete
 * @since 0.1.0
 */
public record RenderResult(Map<String, Object> document, Optional<RenderDiagnostic> diagnostic) {

  public RenderResult {
    Objects.requireNonNull(document, "document");
    diagnostic = Objects.requireNonNullElse(diagnostic, Optional.empty());
  }

  /**
   * Creates a result for a fully rendered document.
   *
   * @param document complete document
   * @return result without diagnostic
   */
  public static RenderResult complete(Map<String, Object> document) {
    return new RenderResult(document, Optional.empty());
  }

  /**
   * Creates a result for a document that stopped at {@code diagnostic}.
   *
   * @param document sections rendered before the failed check
   * @param diagnostic failed check
   * @return result flagged incomplete
   */
  public static RenderResult partial(Map<String, Object> document, RenderDiagnostic diagnostic) {
    return new RenderResult(document, Optional.of(Objects.requireNonNull(diagnostic, "diagnostic")));
  }

  /**
   * Reports whether every mandatory section was rendered.
   *
   * @return {@code true} when no diagnostic was raised
   */
  public boolean isComplete() {
    return diagnostic.isEmpty();
  }

  /**
   * Re-wraps the document under a new one while keeping the diagnostic.
   *
   * @param wrapped enclosing document
   * @return result carrying {@code wrapped} and this diagnostic
   */
  public RenderResult withDocument(Map<String, Object> wrapped) {
    return new RenderResult(wrapped, diagnostic);
  }
}
