package dev.henneberger.vertx.fanout.core;

import java.util.Objects;

/**
 * A configuration problem together with an optional, ready-to-apply solution.
 */
public final class Diagnostic {
  public enum Severity {
    ERROR,
    WARNING
  }

  private final Severity severity;
  private final String code;
  private final String error;
  private final String solution;

  public Diagnostic(Severity severity, String code, String error, String solution) {
    this.severity = Objects.requireNonNull(severity, "severity");
    this.code = Objects.requireNonNull(code, "code");
    this.error = Objects.requireNonNull(error, "error");
    this.solution = solution;
  }

  public static Diagnostic error(String code, String error) {
    return new Diagnostic(Severity.ERROR, code, error, null);
  }

  public static Diagnostic error(String code, String error, String solution) {
    return new Diagnostic(Severity.ERROR, code, error, solution);
  }

  public static Diagnostic warning(String code, String error, String solution) {
    return new Diagnostic(Severity.WARNING, code, error, solution);
  }

  public Severity severity() {
    return severity;
  }

  public String code() {
    return code;
  }

  public String error() {
    return error;
  }

  public String solution() {
    return solution;
  }

  public boolean hasSolution() {
    return solution != null && !solution.isBlank();
  }

  @Override
  public String toString() {
    return Diagnostics.format(this);
  }
}
