package com.scholary.jobrunner.execution;

import java.util.List;
import java.util.Map;

/** Environment handed to job processes: only whitelisted variables of the parent survive. */
public class ChildEnvironment {

  private final List<String> whitelist;
  private final Map<String, String> source;

  public ChildEnvironment(List<String> whitelist) {
    this(whitelist, System.getenv());
  }

  ChildEnvironment(List<String> whitelist, Map<String, String> source) {
    this.whitelist = List.copyOf(whitelist);
    this.source = source;
  }

  /** Replace the contents of {@code target} with the whitelisted subset of the source. */
  public void applyTo(Map<String, String> target) {
    target.clear();
    for (String name : whitelist) {
      String value = source.get(name);
      if (value != null) {
        target.put(name, value);
      }
    }
  }
}
