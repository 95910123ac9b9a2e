package com.scholary.jobrunner.job;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/** The closed set of operations the service can run. */
public enum JobType {
  FETCH("notion:fetch", "Fetch pages from Notion"),
  FETCH_ALL("notion:fetch-all", "Fetch all pages from Notion"),
  COUNT_PAGES("notion:count-pages", "Count pages in Notion database"),
  TRANSLATE("notion:translate", "Translate content"),
  STATUS_TRANSLATION("notion:status-translation", "Update status for translation workflow"),
  STATUS_DRAFT("notion:status-draft", "Update status for draft publish workflow"),
  STATUS_PUBLISH("notion:status-publish", "Update status for publish workflow"),
  STATUS_PUBLISH_PRODUCTION(
      "notion:status-publish-production", "Update status for production publish workflow");

  private final String id;
  private final String description;

  JobType(String id, String description) {
    this.id = id;
    this.description = description;
  }

  public String id() {
    return id;
  }

  public String description() {
    return description;
  }

  public static Optional<JobType> find(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(type -> type.id.equals(id)).findFirst();
  }

  /**
   * Resolve a type id.
   *
   * @throws InvalidJobTypeException if the id is not one of the known types
   */
  public static JobType fromId(String id) {
    return find(id).orElseThrow(() -> new InvalidJobTypeException(id));
  }

  public static String availableIds() {
    return Arrays.stream(values()).map(JobType::id).collect(Collectors.joining(", "));
  }
}
