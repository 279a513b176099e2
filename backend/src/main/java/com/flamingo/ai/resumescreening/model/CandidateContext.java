package com.flamingo.ai.resumescreening.model;

import java.util.List;

/** Hits of one resume selected by a query, in the order the index returned them. */
public record CandidateContext(String documentId, String filename, List<ContextPassage> passages) {

  public CandidateContext {
    passages = List.copyOf(passages);
  }
}
