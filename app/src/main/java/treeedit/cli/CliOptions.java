package treeedit.cli;

import java.util.Objects;
import treeedit.core.EnumerationOptions;
import treeedit.cost.EditCosts;

record CliOptions(
    String treeFile,
    String exampleName,
    OutputFormat format,
    long timeBudgetMs,
    int maxSolutions,
    boolean onlyMinimal,
    EditCosts costs) {

  enum OutputFormat {
    TEXT,
    JSON
  }

  CliOptions {
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(costs, "costs");
    if (timeBudgetMs < 0) {
      throw new IllegalArgumentException("time budget must be non-negative");
    }
    if (maxSolutions < 0) {
      throw new IllegalArgumentException("max solutions must be non-negative");
    }
  }

  boolean hasTreeFile() {
    return treeFile != null && !treeFile.isBlank();
  }

  boolean hasExample() {
    return exampleName != null && !exampleName.isBlank();
  }

  EnumerationOptions enumerationOptions() {
    return new EnumerationOptions(timeBudgetMs, maxSolutions, costs, onlyMinimal);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private String treeFile;
    private String exampleName;
    private OutputFormat format = OutputFormat.TEXT;
    private long timeBudgetMs = EnumerationOptions.defaults().timeBudgetMs();
    private int maxSolutions = EnumerationOptions.defaults().solutionLimit();
    private boolean onlyMinimal = EnumerationOptions.defaults().onlyMinimal();
    private int deletionCost = EditCosts.unit().deletion();
    private int insertionCost = EditCosts.unit().insertion();
    private int substitutionCost = EditCosts.unit().substitution();

    Builder treeFile(String treeFile) {
      this.treeFile = treeFile;
      return this;
    }

    Builder exampleName(String exampleName) {
      this.exampleName = exampleName;
      return this;
    }

    Builder format(OutputFormat format) {
      this.format = format;
      return this;
    }

    Builder timeBudgetMs(long timeBudgetMs) {
      this.timeBudgetMs = timeBudgetMs;
      return this;
    }

    Builder maxSolutions(int maxSolutions) {
      this.maxSolutions = maxSolutions;
      return this;
    }

    Builder onlyMinimal(boolean onlyMinimal) {
      this.onlyMinimal = onlyMinimal;
      return this;
    }

    Builder deletionCost(int deletionCost) {
      this.deletionCost = deletionCost;
      return this;
    }

    Builder insertionCost(int insertionCost) {
      this.insertionCost = insertionCost;
      return this;
    }

    Builder substitutionCost(int substitutionCost) {
      this.substitutionCost = substitutionCost;
      return this;
    }

    CliOptions build() {
      int sources = 0;
      if (treeFile != null && !treeFile.isBlank()) sources++;
      if (exampleName != null && !exampleName.isBlank()) sources++;
      if (sources != 1) {
        throw new IllegalArgumentException("Provide exactly one of --file or --example");
      }
      return new CliOptions(
          treeFile,
          exampleName,
          format,
          timeBudgetMs,
          maxSolutions,
          onlyMinimal,
          new EditCosts(deletionCost, insertionCost, substitutionCost));
    }
  }
}
