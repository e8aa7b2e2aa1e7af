package org.hypertrace.core.query.compiler.smoothing;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.hypertrace.core.query.compiler.InvalidQueryConfigurationException;

/** Series smoothing applied on top of a time binned aggregation. */
public enum SmoothingAlgorithm {
  /** Exponentially weighted moving average, weight is the smoothing factor. */
  EWMA("ewma", List.of("0.7", "0.5", "0.3", "0.1")),
  /** Simple moving average over a fixed window. */
  AUTO("auto", List.of()),
  /** Rolling median, weight is the window size in bins. */
  MEDIAN("median", List.of("3", "5", "7", "9"));

  private final String name;
  private final List<String> weights;

  SmoothingAlgorithm(String name, List<String> weights) {
    this.name = name;
    this.weights = weights;
  }

  public String getName() {
    return name;
  }

  public static Optional<SmoothingAlgorithm> fromName(String name) {
    return Arrays.stream(values()).filter(value -> value.name.equals(name)).findFirst();
  }

  /**
   * Translates the ordinal weight picked in the editor ("0" low to "3" max) into the constant used
   * by this algorithm.
   *
   * @throws InvalidQueryConfigurationException if the index is not an integer in range or the
   *     algorithm takes no weight
   */
  public String translateWeight(String weightIndex) {
    if (weights.isEmpty()) {
      throw new InvalidQueryConfigurationException(
          String.format("Invalid configuration: smoothing algorithm %s has no weights", name));
    }
    int index;
    try {
      index = Integer.parseInt(String.valueOf(weightIndex).trim());
    } catch (NumberFormatException e) {
      throw new InvalidQueryConfigurationException(
          String.format("Invalid configuration: smoothing weight %s is not a number", weightIndex),
          e);
    }
    if (index < 0 || index >= weights.size()) {
      throw new InvalidQueryConfigurationException(
          String.format(
              "Invalid configuration: smoothing weight %d is out of range [0, %d]",
              index, weights.size() - 1));
    }
    return weights.get(index);
  }
}
