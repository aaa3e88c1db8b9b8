package io.b2mash.memberhours.ledger;

import io.b2mash.memberhours.exception.ValidationException;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Reads the {@code hours} request field, which clients send either as a JSON number or as a
 * numeric string using a comma or a dot as decimal separator.
 */
final class HoursValue {

  private HoursValue() {}

  static BigDecimal parse(Object raw) {
    if (raw == null) {
      return null;
    }
    if (raw instanceof BigDecimal decimal) {
      return decimal;
    }
    if (raw instanceof Integer || raw instanceof Long || raw instanceof BigInteger) {
      return new BigDecimal(raw.toString());
    }
    if (raw instanceof Number number) {
      return BigDecimal.valueOf(number.doubleValue());
    }
    if (raw instanceof String text) {
      String normalized = text.trim().replace(',', '.');
      if (normalized.isEmpty()) {
        return null;
      }
      try {
        return new BigDecimal(normalized);
      } catch (NumberFormatException e) {
        throw new ValidationException("hours must be a number");
      }
    }
    throw new ValidationException("hours must be a number");
  }
}
