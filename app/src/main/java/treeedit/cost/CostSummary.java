package treeedit.cost;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Aggregate view over a scored solution set.
 *
 * @param witness first minimum-cost mapping in enumeration order
 * @param histogram number of mappings per cost, ordered by cost
 */
public record CostSummary(
    ScoredMapping witness, int minimalCount, Map<Integer, Integer> histogram) {

  public CostSummary {
    Objects.requireNonNull(witness, "witness");
    histogram = Collections.unmodifiableMap(new TreeMap<>(histogram));
  }

  public int minimumCost() {
    return witness.cost();
  }
}
