package treeedit.cost;

import java.util.List;
import java.util.Objects;

/** Ordered edit operations implied by a mapping, with their summed cost. */
public record EditScript(List<EditOperation> operations, int totalCost) {

  public EditScript {
    Objects.requireNonNull(operations, "operations");
    operations = List.copyOf(operations);
  }

  public long count(EditOperation.Type type) {
    return operations.stream().filter(op -> op.type() == type).count();
  }

  /** Operations other than matches. */
  public List<EditOperation> changes() {
    return operations.stream().filter(EditOperation::isChange).toList();
  }
}
