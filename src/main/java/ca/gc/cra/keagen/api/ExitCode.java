package ca.gc.cra.keagen.api;

/**
 * <strong>What:</strong> Exit codes shared by the generator's command-line tools.
 * <p><strong>Why:</strong> Provisioning scripts decide whether to reload Kea based on the process status, so an
 * incomplete document must be distinguishable from bad arguments or an I/O failure.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Document rendered (and written, unless dry-run). */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Reading configuration or writing the document failed. */
  IO_ERROR(3),
  /** Configuration rendered an incomplete document. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value reported to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
