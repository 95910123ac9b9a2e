package com.scholary.jobrunner.execution;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Options a client may pass when creating a job. Every field is optional; unknown fields are
 * ignored.
 *
 * @param maxPages cap on the number of pages processed
 * @param statusFilter only process pages in this status
 * @param force reprocess pages that are already up to date
 * @param dryRun report what would change without writing anything
 * @param includeRemoved include pages marked as removed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobOptions(
    Integer maxPages,
    String statusFilter,
    Boolean force,
    Boolean dryRun,
    Boolean includeRemoved) {

  private static final JobOptions NONE = new JobOptions(null, null, null, null, null);

  public static JobOptions none() {
    return NONE;
  }

  public static JobOptions orNone(JobOptions options) {
    return options == null ? NONE : options;
  }
}
