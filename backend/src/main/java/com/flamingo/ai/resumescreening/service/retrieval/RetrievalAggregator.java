package com.flamingo.ai.resumescreening.service.retrieval;

import com.flamingo.ai.resumescreening.model.CandidateContext;
import com.flamingo.ai.resumescreening.model.ContextPassage;
import com.flamingo.ai.resumescreening.model.RetrievalHit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Groups retrieval hits into one {@link CandidateContext} per resume.
 *
 * <p>Documents appear in the order of their first hit; passages keep the order the index returned
 * them in.
 */
@Component
public class RetrievalAggregator {

  /**
   * Groups hits by document.
   *
   * @param hits hits, best first
   * @return contexts keyed by document id, in first-seen order; empty for empty input
   */
  public LinkedHashMap<String, CandidateContext> aggregate(List<RetrievalHit> hits) {
    Map<String, String> filenames = new LinkedHashMap<>();
    Map<String, List<ContextPassage>> passages = new LinkedHashMap<>();
    for (RetrievalHit hit : hits) {
      filenames.putIfAbsent(hit.documentId(), hit.filename());
      passages
          .computeIfAbsent(hit.documentId(), id -> new ArrayList<>())
          .add(new ContextPassage(hit.text(), hit.relevanceScore()));
    }

    LinkedHashMap<String, CandidateContext> contexts = new LinkedHashMap<>();
    passages.forEach(
        (documentId, documentPassages) ->
            contexts.put(
                documentId,
                new CandidateContext(documentId, filenames.get(documentId), documentPassages)));
    return contexts;
  }

  /** Renders one resume's evidence as {@code [Resume: filename]} followed by its passages. */
  public String combinedContext(CandidateContext context) {
    String body =
        context.passages().stream().map(ContextPassage::text).collect(Collectors.joining("\n"));
    return "[Resume: " + context.filename() + "]\n" + body;
  }

  /** Renders several resumes, separated by a blank line. */
  public String combinedContext(Collection<CandidateContext> contexts) {
    return contexts.stream().map(this::combinedContext).collect(Collectors.joining("\n\n"));
  }
}
