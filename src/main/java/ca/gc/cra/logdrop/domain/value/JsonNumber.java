package ca.gc.cra.logdrop.domain.value;

import java.math.BigDecimal;

/**
 * JSON number held as a double, the only numeric representation the router uses.
 *
 * @param value numeric value
 * @since 0.1.0
 */
public record JsonNumber(double value) implements Value {

  /**
   * Renders the number in plain decimal form: integral values drop the fraction ({@code 42}, not
   * {@code 42.0}) and no exponent notation is used for finite values.
   *
   * @return decimal text
   */
  public String toPlainString() {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return Double.toString(value);
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  @Override
  public String toString() {
    return toPlainString();
  }
}
