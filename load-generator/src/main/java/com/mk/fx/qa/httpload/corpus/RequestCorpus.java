package com.mk.fx.qa.httpload.corpus;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.httpload.http.RequestSpec;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * In-memory table of (URL, body) pairs from which each request draws its parameters. Entries
 * loaded from a body-only file carry an empty URL. Immutable and safe to share across workers.
 */
public final class RequestCorpus {

  private static final RequestCorpus EMPTY = new RequestCorpus(List.of());

  private final List<RequestSpec> entries;

  private RequestCorpus(List<RequestSpec> entries) {
    this.entries = List.copyOf(entries);
  }

  public static RequestCorpus empty() {
    return EMPTY;
  }

  /** Corpus of (URL, body) pairs; an empty URL stands for the default target. */
  public static RequestCorpus of(List<RequestSpec> entries) {
    Objects.requireNonNull(entries, "entries");
    return entries.isEmpty() ? EMPTY : new RequestCorpus(entries);
  }

  /** Corpus of bodies sent to the default target. */
  public static RequestCorpus ofBodies(List<String> bodies) {
    Objects.requireNonNull(bodies, "bodies");
    return of(bodies.stream().map(body -> new RequestSpec("", body)).toList());
  }

  /**
   * Draws the parameters of one request.
   *
   * @param defaultUrl target used when the corpus is empty or the drawn entry has no URL
   * @return a uniformly random entry with its URL resolved
   */
  public RequestSpec sample(String defaultUrl) {
    return sample(defaultUrl, ThreadLocalRandom.current());
  }

  @VisibleForTesting
  RequestSpec sample(String defaultUrl, Random random) {
    Objects.requireNonNull(defaultUrl, "defaultUrl");
    if (entries.isEmpty()) {
      return new RequestSpec(defaultUrl, "");
    }
    var entry = entries.get(random.nextInt(entries.size()));
    return entry.url().isEmpty() ? new RequestSpec(defaultUrl, entry.body()) : entry;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public List<RequestSpec> entries() {
    return entries;
  }
}
