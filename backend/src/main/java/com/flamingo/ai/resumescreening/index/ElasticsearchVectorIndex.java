package com.flamingo.ai.resumescreening.index;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.aggregations.CompositeAggregate;
import co.elastic.clients.elasticsearch._types.aggregations.CompositeAggregationSource;
import co.elastic.clients.elasticsearch._types.aggregations.CompositeBucket;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.resumescreening.config.ScreeningConfig;
import com.flamingo.ai.resumescreening.exception.SearchException;
import com.flamingo.ai.resumescreening.model.DocumentMetadata;
import com.flamingo.ai.resumescreening.model.ResumeChunk;
import com.flamingo.ai.resumescreening.model.RetrievalHit;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * {@link VectorIndex} on an Elasticsearch {@code dense_vector} field with cosine similarity.
 *
 * <p>Elasticsearch reports cosine kNN scores as {@code (1 + cos) / 2}; hits carry the cosine
 * distance {@code 1 - cos}, i.e. {@code 2 - 2 * score}.
 */
@Service
@ConditionalOnProperty(
    name = "screening.vector-index.type",
    havingValue = "elasticsearch",
    matchIfMissing = true)
@Slf4j
public class ElasticsearchVectorIndex extends AbstractElasticsearchIndexService<ResumeChunk>
    implements VectorIndex {

  private static final int MAX_RESULT_WINDOW = 10_000;
  private static final String DOCUMENT_IDS_AGGREGATION = "document_ids";
  private static final String DOCUMENT_ID_SOURCE = "document_id";
  private static final int DEFAULT_DOCUMENT_ID_PAGE_SIZE = 1000;

  private final String indexName;
  private final int vectorDimensions;
  private int documentIdPageSize = DEFAULT_DOCUMENT_ID_PAGE_SIZE;

  @Autowired
  public ElasticsearchVectorIndex(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      ScreeningConfig screeningConfig) {
    this(
        elasticsearchClient,
        meterRegistry,
        screeningConfig.getVectorIndex().getIndexName(),
        screeningConfig.getVectorIndex().getDimensions());
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public ElasticsearchVectorIndex(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  public String type() {
    return "elasticsearch";
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // keyword fields are matched exactly by filters and aggregations
    properties.put(FILTER_DOCUMENT_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(FILTER_FILENAME, Property.of(p -> p.keyword(k -> k)));
    properties.put("ordinal", Property.of(p -> p.integer(i -> i)));
    properties.put("text", Property.of(p -> p.text(t -> t)));
    properties.put("pageCount", Property.of(p -> p.integer(i -> i)));
    properties.put("ingestedAt", Property.of(p -> p.date(d -> d)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(ResumeChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put(FILTER_DOCUMENT_ID, chunk.getDocumentId());
    document.put(FILTER_FILENAME, chunk.getFilename());
    document.put("ordinal", chunk.getOrdinal());
    document.put("text", chunk.getText());
    document.put("pageCount", chunk.getPageCount());
    if (chunk.getIngestedAt() != null) {
      document.put("ingestedAt", chunk.getIngestedAt().toString());
    }
    document.put("embedding", chunk.getEmbedding());
    return document;
  }

  @Override
  protected ResumeChunk convertFromDocument(String id, Map<String, Object> source) {
    Object ingestedAt = source.get("ingestedAt");
    return ResumeChunk.builder()
        .chunkId(id)
        .documentId((String) source.get(FILTER_DOCUMENT_ID))
        .filename((String) source.get(FILTER_FILENAME))
        .ordinal(intValue(source.get("ordinal")))
        .text((String) source.get("text"))
        .pageCount(intValue(source.get("pageCount")))
        .ingestedAt(ingestedAt == null ? null : Instant.parse(ingestedAt.toString()))
        .build();
  }

  @Override
  protected String getDocumentId(ResumeChunk entity) {
    return entity.getChunkId();
  }

  @Override
  protected String getMetricPrefix() {
    return "resume_chunk";
  }

  @Override
  @Timed(value = "vector_index.upsert", description = "Time to store a document's chunks")
  @CircuitBreaker(name = "elasticsearch")
  public void upsert(
      String documentId,
      List<String> chunks,
      List<List<Float>> embeddings,
      DocumentMetadata metadata) {
    List<ResumeChunk> batch = ChunkBatch.build(documentId, chunks, embeddings, metadata);
    bulkIndex(batch);
    log.debug("Stored {} chunks for document {}", batch.size(), documentId);
  }

  @Override
  @Timed(value = "vector_index.query", description = "Time for kNN search")
  @CircuitBreaker(name = "elasticsearch")
  public List<RetrievalHit> query(List<Float> embedding, int topK, Map<String, Object> filter) {
    if (topK <= 0) {
      return List.of();
    }
    List<Query> filters = buildFilters(filter);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        k -> {
                          k.field("embedding")
                              .queryVector(embedding)
                              .k(topK)
                              .numCandidates(Math.max(topK * 2, 10));
                          if (!filters.isEmpty()) {
                            k.filter(filters);
                          }
                          return k;
                        })
                    .source(src -> src.filter(f -> f.excludes("embedding")))
                    .size(topK));

    List<RetrievalHit> results = new ArrayList<>();
    for (Hit<SourceDocument> hit : search(request, "vector_search")) {
      List<ResumeChunk> chunk = toEntities(List.of(hit));
      if (chunk.isEmpty()) {
        continue;
      }
      results.add(RetrievalHit.of(chunk.get(0), distanceFromScore(hit.score())));
    }
    return results;
  }

  @VisibleForTesting
  static double distanceFromScore(Double score) {
    return score == null ? 1.0 : Math.max(0.0, 2.0 - 2.0 * score);
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public List<ResumeChunk> getChunks(String documentId) {
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(q -> q.term(t -> t.field(FILTER_DOCUMENT_ID).value(documentId)))
                    .sort(so -> so.field(f -> f.field("ordinal").order(SortOrder.Asc)))
                    .source(src -> src.filter(f -> f.excludes("embedding")))
                    .size(MAX_RESULT_WINDOW));
    return toEntities(search(request, "get_chunks"));
  }

  @Override
  @Timed(value = "vector_index.delete", description = "Time to delete a document's chunks")
  @CircuitBreaker(name = "elasticsearch")
  public void delete(String documentId) {
    long deleted =
        deleteByQuery(Query.of(q -> q.term(t -> t.field(FILTER_DOCUMENT_ID).value(documentId))));
    log.debug("Deleted {} chunks of document {}", deleted, documentId);
  }

  /** Pages through every distinct document id with a composite aggregation, in id order. */
  @Override
  @CircuitBreaker(name = "elasticsearch")
  public Set<String> listDocumentIds() {
    Set<String> documentIds = new LinkedHashSet<>();
    Map<String, FieldValue> afterKey = null;
    do {
      CompositeAggregate page = fetchDocumentIdPage(afterKey);
      List<CompositeBucket> buckets = page.buckets().array();
      for (CompositeBucket bucket : buckets) {
        documentIds.add(bucket.key().get(DOCUMENT_ID_SOURCE).stringValue());
      }
      Map<String, FieldValue> next = page.afterKey();
      boolean lastPage = buckets.size() < documentIdPageSize || next == null || next.isEmpty();
      afterKey = lastPage ? null : next;
    } while (afterKey != null);
    log.debug("Listed {} document ids in {}", documentIds.size(), indexName);
    return documentIds;
  }

  private CompositeAggregate fetchDocumentIdPage(Map<String, FieldValue> afterKey) {
    List<Map<String, CompositeAggregationSource>> sources =
        List.of(
            Map.of(
                DOCUMENT_ID_SOURCE,
                CompositeAggregationSource.of(src -> src.terms(t -> t.field(FILTER_DOCUMENT_ID)))));
    try {
      SearchResponse<Void> response =
          elasticsearchClient.search(
              s ->
                  s.index(indexName)
                      .size(0)
                      .aggregations(
                          DOCUMENT_IDS_AGGREGATION,
                          a ->
                              a.composite(
                                  c -> {
                                    c.size(documentIdPageSize).sources(sources);
                                    if (afterKey != null) {
                                      c.after(afterKey);
                                    }
                                    return c;
                                  })),
              Void.class);
      return response.aggregations().get(DOCUMENT_IDS_AGGREGATION).composite();
    } catch (IOException e) {
      log.error("Listing document ids failed for {}: {}", indexName, e.getMessage(), e);
      throw new SearchException("Listing documents failed", e);
    }
  }

  @VisibleForTesting
  void setDocumentIdPageSize(int documentIdPageSize) {
    this.documentIdPageSize = documentIdPageSize;
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public List<ResumeChunk> searchText(String keyword, int limit) {
    if (keyword == null || keyword.isBlank() || limit <= 0) {
      return List.of();
    }
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(q -> q.match(m -> m.field("text").query(keyword)))
                    .source(src -> src.filter(f -> f.excludes("embedding")))
                    .size(limit));
    return toEntities(search(request, "keyword_search"));
  }

  private List<Query> buildFilters(Map<String, Object> filter) {
    List<Query> filters = new ArrayList<>();
    if (filter == null) {
      return filters;
    }
    for (Map.Entry<String, Object> entry : filter.entrySet()) {
      if (!FILTER_DOCUMENT_ID.equals(entry.getKey()) && !FILTER_FILENAME.equals(entry.getKey())) {
        throw new IllegalArgumentException("Unsupported filter field: " + entry.getKey());
      }
      String value = String.valueOf(entry.getValue());
      filters.add(Query.of(q -> q.term(t -> t.field(entry.getKey()).value(value))));
    }
    return filters;
  }

  private static int intValue(Object value) {
    return value instanceof Number n ? n.intValue() : 0;
  }
}
