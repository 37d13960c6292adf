package com.mk.fx.qa.httpload.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.httpload.http.RequestSpec;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Objects;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Loads a {@link RequestCorpus} from a JSON file in one of two shapes:
 *
 * <ul>
 *   <li>{@code ["body1", "body2", ...]} - bodies sent to the default target
 *   <li>{@code [["url1", "body1"], ["url2", "body2"], ...]} - explicit targets; an empty URL or a
 *       one-element array means the default target
 * </ul>
 *
 * <p>A file that cannot be read or does not match either shape is not fatal: the problem is logged
 * and an empty corpus is returned, so the run falls back to the default target with empty bodies.
 */
@Slf4j
@Component
public class RequestCorpusLoader {

  private final ObjectMapper objectMapper;

  public RequestCorpusLoader(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  /**
   * Loads the corpus file.
   *
   * @param file path of the JSON corpus
   * @return the corpus, empty if the file is missing or malformed
   */
  public RequestCorpus load(Path file) {
    Objects.requireNonNull(file, "file");
    if (!Files.isReadable(file)) {
      log.warn("Unable to read request corpus {}: file is missing or not readable", file);
      return RequestCorpus.empty();
    }
    try {
      var corpus = parse(objectMapper.readTree(file.toFile()));
      log.info("Loaded {} request entries from {}", corpus.size(), file);
      return corpus;
    } catch (IOException e) {
      log.warn("Unable to parse request corpus {} as JSON: {}", file, e.getMessage());
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring request corpus {}: {}", file, e.getMessage());
    }
    return RequestCorpus.empty();
  }

  /**
   * Normalises either supported shape into (URL, body) pairs.
   *
   * @throws IllegalArgumentException if the document matches neither shape
   */
  @VisibleForTesting
  RequestCorpus parse(JsonNode root) {
    if (root == null || !root.isArray()) {
      throw new IllegalArgumentException("expected a JSON array of strings or of [url, body] arrays");
    }
    if (root.isEmpty()) {
      return RequestCorpus.empty();
    }
    if (allMatch(root, JsonNode::isTextual)) {
      var bodies = new ArrayList<String>(root.size());
      root.forEach(node -> bodies.add(node.asText()));
      return RequestCorpus.ofBodies(bodies);
    }
    if (allMatch(root, JsonNode::isArray)) {
      var entries = new ArrayList<RequestSpec>(root.size());
      for (int i = 0; i < root.size(); i++) {
        entries.add(toEntry(root.get(i), i));
      }
      return RequestCorpus.of(entries);
    }
    throw new IllegalArgumentException(
        "entries must be either all strings or all [url, body] arrays");
  }

  private static RequestSpec toEntry(JsonNode pair, int index) {
    if (pair.size() < 1 || pair.size() > 2 || !allMatch(pair, JsonNode::isTextual)) {
      throw new IllegalArgumentException(
          "entry " + index + " must be [\"body\"] or [\"url\", \"body\"] with string values");
    }
    return pair.size() == 1
        ? new RequestSpec("", pair.get(0).asText())
        : new RequestSpec(pair.get(0).asText(), pair.get(1).asText());
  }

  private static boolean allMatch(JsonNode array, Predicate<JsonNode> test) {
    for (JsonNode node : array) {
      if (!test.test(node)) {
        return false;
      }
    }
    return true;
  }

  /** Convenience used when no corpus file is configured. */
  public RequestCorpus loadOrEmpty(String file) {
    return file == null || file.isBlank() ? RequestCorpus.empty() : load(Path.of(file.trim()));
  }
}
