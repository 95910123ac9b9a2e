package com.scholary.jobrunner.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls the structured result out of a job's stdout. Scripts print their summary as a single
 * JSON object line, normally the last one.
 */
public class JsonOutputExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonOutputExtractor.class);

  private final ObjectMapper objectMapper;

  public JsonOutputExtractor(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parse the last line of {@code output} that starts with {@code {}.
   *
   * @return the parsed object, or null if there is no such line or it is not valid JSON
   */
  public JsonNode extract(String output) {
    if (output == null || output.isEmpty()) {
      return null;
    }

    String[] lines = output.split("\\R");
    for (int i = lines.length - 1; i >= 0; i--) {
      String line = lines[i].trim();
      if (line.startsWith("{")) {
        try {
          return objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
          LOGGER.debug("Last JSON-looking output line is not valid JSON: {}", e.getMessage());
          return null;
        }
      }
    }
    return null;
  }
}
