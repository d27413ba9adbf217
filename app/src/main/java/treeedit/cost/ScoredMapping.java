package treeedit.cost;

import java.util.Objects;
import treeedit.mapping.EditMapping;

/**
 * A mapping paired with its edit cost.
 *
 * @param index position of the mapping in enumeration order, 0-based
 */
public record ScoredMapping(int index, EditMapping mapping, int cost) {

  public ScoredMapping {
    Objects.requireNonNull(mapping, "mapping");
  }
}
