package ca.gc.cra.logdrop.domain.value;

/**
 * JSON {@code null}.
 *
 * @since 0.1.0
 */
public enum JsonNull implements Value {
  INSTANCE;

  @Override
  public String toString() {
    return "null";
  }
}
