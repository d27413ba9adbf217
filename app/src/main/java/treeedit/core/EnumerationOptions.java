package treeedit.core;

import treeedit.cost.EditCosts;

/**
 * Configuration for a mapping enumeration run.
 *
 * @param timeBudgetMs wall-clock budget for the search; {@code 0} disables it
 * @param solutionLimit stop after this many mappings; {@code 0} disables it
 * @param costs per-operation weights used when scoring mappings
 * @param onlyMinimal keep only minimum-cost mappings in the reported result
 */
public record EnumerationOptions(
    long timeBudgetMs, int solutionLimit, EditCosts costs, boolean onlyMinimal) {

  public static EnumerationOptions defaults() {
    return new EnumerationOptions(0, 0, EditCosts.unit(), false);
  }

  public static EnumerationOptions normalize(EnumerationOptions options) {
    if (options == null) {
      return defaults();
    }
    long timeBudgetMs = Math.max(0, options.timeBudgetMs());
    int solutionLimit = Math.max(0, options.solutionLimit());
    EditCosts costs = options.costs() != null ? options.costs() : EditCosts.unit();
    return new EnumerationOptions(timeBudgetMs, solutionLimit, costs, options.onlyMinimal());
  }

  public boolean isBounded() {
    return timeBudgetMs > 0 || solutionLimit > 0;
  }
}
