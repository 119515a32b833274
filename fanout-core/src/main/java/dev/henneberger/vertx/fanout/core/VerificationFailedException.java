package dev.henneberger.vertx.fanout.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class VerificationFailedException extends IllegalStateException {

  private final String subject;
  private final List<Diagnostic> diagnostics;

  public VerificationFailedException(String subject, List<Diagnostic> diagnostics) {
    super(Diagnostics.describeFailure(subject, Objects.requireNonNull(diagnostics, "diagnostics")));
    this.subject = subject;
    this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
  }

  public String subject() {
    return subject;
  }

  public List<Diagnostic> diagnostics() {
    return diagnostics;
  }
}
