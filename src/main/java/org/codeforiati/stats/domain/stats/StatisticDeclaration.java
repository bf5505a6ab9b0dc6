package org.codeforiati.stats.domain.stats;

import java.util.Objects;

/**
 * <strong>What:</strong> Named statistic with declared shape, aggregation mode and pure function.
 * <p><strong>Why:</strong> Registries iterate declarations instead of discovering statistics reflectively, and the
 * declared shape is enforced on every evaluation.</p>
 * <p><strong>Thread-safety:</strong> Immutable; functions must be stateless.</p>
 *
 * @param name statistic name, unique within a registry
 * @param shape declared result shape
 * @param mode aggregation mode
 * @param function statistic body
 * @param <C> evaluation context type
 * @since 0.1.0
 */
public record StatisticDeclaration<C>(
    String name, Shape shape, AggregationMode mode, StatFunction<C> function) {

  public StatisticDeclaration {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    Objects.requireNonNull(shape, "shape");
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(function, "function");
  }

  public static <C> StatisticDeclaration<C> summed(String name, Shape shape, StatFunction<C> function) {
    return new StatisticDeclaration<>(name, shape, AggregationMode.SUMMED, function);
  }

  public static <C> StatisticDeclaration<C> derived(String name, Shape shape, StatFunction<C> function) {
    return new StatisticDeclaration<>(name, shape, AggregationMode.NO_AGGREGATION, function);
  }

  /**
   * Evaluates the function and enforces the declared shape.
   *
   * @param context evaluation context
   * @return the computed value, or the shape identity when the function returned {@code null}
   * @throws IllegalStateException if the function returned a value of another shape
   */
  public StatResult evaluate(C context) {
    StatResult result = function.apply(context);
    if (result == null) {
      return shape.identity();
    }
    if (result.shape() != shape) {
      throw new IllegalStateException(
          "statistic " + name + " declared " + shape + " but produced " + result.shape());
    }
    return result;
  }

  public boolean isFoldable() {
    return mode == AggregationMode.SUMMED;
  }
}
