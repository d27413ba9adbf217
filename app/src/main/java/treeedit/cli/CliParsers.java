package treeedit.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import treeedit.examples.Example;
import treeedit.loader.TreeFileLoader;
import treeedit.model.TreePair;

/** Shared helpers for CLI argument parsing and tree-pair loading. */
final class CliParsers {

  private CliParsers() {}

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, long defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  static CliOptions.OutputFormat parseFormat(String raw) {
    if (raw == null || raw.isBlank()) {
      return CliOptions.OutputFormat.TEXT;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "text", "txt" -> CliOptions.OutputFormat.TEXT;
      case "json" -> CliOptions.OutputFormat.JSON;
      default -> throw new IllegalArgumentException("Invalid format: " + raw);
    };
  }

  static TreePair loadPair(CliOptions options) throws IOException {
    if (options.hasExample()) {
      return Example.byName(options.exampleName());
    }
    if (options.hasTreeFile()) {
      return new TreeFileLoader().load(Path.of(options.treeFile()));
    }
    throw new IllegalStateException("Missing tree input.");
  }
}
