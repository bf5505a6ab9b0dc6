package org.codeforiati.stats.domain.stats;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Scalar count or exact decimal sum.
 *
 * @param value exact value; never {@code null}
 * @since 0.1.0
 */
public record NumberStat(BigDecimal value) implements StatResult {
  public static final NumberStat ZERO = new NumberStat(BigDecimal.ZERO);
  public static final NumberStat ONE = new NumberStat(BigDecimal.ONE);

  public NumberStat {
    Objects.requireNonNull(value, "value");
  }

  public static NumberStat of(long value) {
    return value == 0 ? ZERO : new NumberStat(BigDecimal.valueOf(value));
  }

  public static NumberStat of(boolean flag) {
    return flag ? ONE : ZERO;
  }

  @Override
  public Shape shape() {
    return Shape.NUMBER;
  }

  @Override
  public boolean isEmpty() {
    return value.signum() == 0;
  }
}
