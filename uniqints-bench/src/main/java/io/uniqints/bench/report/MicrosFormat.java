package io.uniqints.bench.report;

import java.math.BigDecimal;

/**
 * Prints a microsecond value in plain notation with at least one decimal, e.g. {@code 1250.0},
 * {@code 12500000.0}, {@code 0.0001}. Never switches to exponent form.
 */
final class MicrosFormat
{
  private MicrosFormat()
  {
  }

  static String format(double micros)
  {
    String plain = BigDecimal.valueOf(micros).stripTrailingZeros().toPlainString();
    return plain.indexOf('.') < 0 ? plain + ".0" : plain;
  }
}
