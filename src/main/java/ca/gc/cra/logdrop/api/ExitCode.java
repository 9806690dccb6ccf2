package ca.gc.cra.logdrop.api;

/**
 * <strong>What:</strong> Process exit codes reported by the {@code logdrop} command line.
 * <p><strong>Why:</strong> Lets supervisors distinguish bad arguments from bad configuration and from crashes.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Router ran and stopped normally, or help/dry-run completed. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Configuration file could not be read. */
  IO_ERROR(3),
  /** Configuration was malformed or failed validation. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure while starting or running the router. */
  RUNTIME_FAILURE(5),
  /** Interrupted while waiting for shutdown. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric status handed to {@link System#exit(int)}.
   *
   * @return process exit status
   */
  public int code() {
    return code;
  }
}
