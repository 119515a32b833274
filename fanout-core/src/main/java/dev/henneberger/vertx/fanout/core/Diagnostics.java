package dev.henneberger.vertx.fanout.core;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class Diagnostics {

  private Diagnostics() {
  }

  public static boolean hasErrors(List<Diagnostic> diagnostics) {
    Objects.requireNonNull(diagnostics, "diagnostics");
    for (Diagnostic diagnostic : diagnostics) {
      if (diagnostic.severity() == Diagnostic.Severity.ERROR) {
        return true;
      }
    }
    return false;
  }

  public static String describeFailure(String subject, List<Diagnostic> diagnostics) {
    Objects.requireNonNull(diagnostics, "diagnostics");
    return "Verification of " + subject + " failed: " + diagnostics.stream()
      .map(Diagnostics::format)
      .collect(Collectors.joining("; "));
  }

  static String format(Diagnostic diagnostic) {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(diagnostic.code()).append("] ").append(diagnostic.error());
    if (diagnostic.hasSolution()) {
      sb.append(" Solution: ").append(diagnostic.solution());
    }
    return sb.toString();
  }
}
