package org.hypertrace.core.query.compiler;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.typesafe.config.Config;
import java.util.Set;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.hypertrace.core.query.compiler.smoothing.SmoothingAlgorithm;

@Value
@NonFinal
public class QueryCompilerConfig {

  private static final String CONFIG_PATH_UNARY_OPERATORS = "unaryOperators";
  private static final String CONFIG_PATH_AUTOCOMPLETE = "autocomplete";
  private static final String CONFIG_PATH_SMOOTHING = "smoothing";

  Set<String> unaryOperators;
  AutocompleteConfig autocompleteConfig;
  SmoothingConfig smoothingConfig;

  public QueryCompilerConfig(Config config) {
    Config resolved = config.resolve();
    this.unaryOperators =
        ImmutableSet.copyOf(resolved.getStringList(CONFIG_PATH_UNARY_OPERATORS));
    this.autocompleteConfig =
        new AutocompleteConfig(resolved.getConfig(CONFIG_PATH_AUTOCOMPLETE));
    this.smoothingConfig = new SmoothingConfig(resolved.getConfig(CONFIG_PATH_SMOOTHING));
  }

  @Value
  @NonFinal
  public static class AutocompleteConfig {
    private static final String CONFIG_PATH_SCAN_LIMIT = "scanLimit";
    private static final String CONFIG_PATH_RESULT_LIMIT = "resultLimit";

    /* rows scanned before computing distinct values */
    int scanLimit;
    /* distinct values returned to the editor */
    int resultLimit;

    private AutocompleteConfig(Config config) {
      this.scanLimit = config.getInt(CONFIG_PATH_SCAN_LIMIT);
      this.resultLimit = config.getInt(CONFIG_PATH_RESULT_LIMIT);
      Preconditions.checkArgument(scanLimit > 0, "autocomplete.scanLimit must be positive");
      Preconditions.checkArgument(resultLimit > 0, "autocomplete.resultLimit must be positive");
    }
  }

  @Value
  @NonFinal
  public static class SmoothingConfig {
    private static final String CONFIG_PATH_DEFAULT_WEIGHT = "defaultWeight";

    String defaultWeight;

    private SmoothingConfig(Config config) {
      this.defaultWeight = config.getString(CONFIG_PATH_DEFAULT_WEIGHT);
      // fail at startup rather than on the first smoothed query
      SmoothingAlgorithm.EWMA.translateWeight(defaultWeight);
    }
  }
}
