package com.scholary.jobrunner.progress;

import java.util.regex.Pattern;

/**
 * One recognised progress line format. The pattern must capture the current count in group 1 and
 * the total in group 2.
 *
 * @param name short label used in logs
 * @param pattern compiled, case-insensitive pattern
 */
public record ProgressPattern(String name, Pattern pattern) {

  public static ProgressPattern of(String name, String regex) {
    return new ProgressPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
  }
}
