package com.github.llfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Collects the diagnostics of one read. Every report is also logged at warn level.
 */
public final class Diagnostics {
  private static final Logger logger = LogManager.getLogger(Diagnostics.class.getSimpleName());

  private final List<Diagnostic> reported = new ArrayList<>();

  public void report(final String location, final String message) {
    final Diagnostic diagnostic = new Diagnostic(location, message);
    reported.add(diagnostic);
    logger.warn(diagnostic);
  }

  public List<Diagnostic> getReported() {
    return Collections.unmodifiableList(reported);
  }

  public boolean isEmpty() {
    return reported.isEmpty();
  }

  public int size() {
    return reported.size();
  }

}
