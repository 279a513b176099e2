package com.flamingo.ai.resumescreening.index;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.resumescreening.exception.SearchException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for Elasticsearch-backed indexes.
 *
 * <p>Owns index bootstrap, mapping validation, bulk writes, delete-by-query and raw searches.
 * Subclasses define the schema and the conversion between their entity and the stored source map.
 *
 * @param <T> the entity type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  public abstract String getIndexName();

  /**
   * Defines the index properties (schema) for this entity type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  /**
   * Converts a stored source map back to an entity.
   *
   * @param id the Elasticsearch {@code _id}
   * @param source the stored source
   * @return the entity
   */
  protected abstract T convertFromDocument(String id, Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  /** Metric prefix for this index, e.g. {@code resume_chunk}. */
  protected abstract String getMetricPrefix();

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (IOException e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false: only the declared fields are mapped
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to an existing index and fails fast on type mismatches, which need the
   * index to be recreated.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual == null) {
        missingFields.put(entry.getKey(), entry.getValue());
      } else if (entry.getValue()._kind() != actual._kind()) {
        mismatches.add(
            String.format(
                "field '%s' expected type '%s' but found '%s'",
                entry.getKey(), entry.getValue()._kind(), actual._kind()));
      }
    }
    if (!mismatches.isEmpty()) {
      String message =
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s): "
              + String.join("; ", mismatches)
              + ". Delete the index and restart to apply the current mapping.";
      log.error(message);
      throw new IllegalStateException(message);
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified", getIndexName());
    }
  }

  /**
   * Writes entities with one bulk request and waits until they are visible to searches.
   *
   * @throws SearchException if the request fails or any item is rejected
   */
  protected void bulkIndex(List<T> entities) {
    if (entities.isEmpty()) {
      return;
    }
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
      for (T entity : entities) {
        String id = getDocumentId(entity);
        Map<String, Object> source = convertToDocument(entity);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(source)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        List<String> reasons = new ArrayList<>();
        for (BulkResponseItem item : response.items()) {
          if (item.error() != null) {
            reasons.add(item.id() + ": " + item.error().reason());
          }
        }
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        throw new SearchException(
            "Failed to index " + reasons.size() + " item(s) in " + getIndexName() + ": " + reasons);
      }
      log.debug("Indexed {} entities to {}", entities.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(entities.size());
    } catch (IOException e) {
      log.error("Failed to index entities to {}: {}", getIndexName(), e.getMessage(), e);
      throw new SearchException("Failed to index entities", e);
    }
  }

  /** Runs a search and returns the hits with their sources as plain field maps. */
  protected List<Hit<SourceDocument>> search(SearchRequest request, String operation) {
    try {
      SearchResponse<SourceDocument> response =
          elasticsearchClient.search(request, SourceDocument.class);
      List<Hit<SourceDocument>> hits = response.hits().hits();
      log.debug("[{}] index={} returned={}", operation, getIndexName(), hits.size());
      meterRegistry.counter(getMetricPrefix() + "." + operation).increment();
      return hits;
    } catch (IOException e) {
      log.error("{} failed for {}: {}", operation, getIndexName(), e.getMessage(), e);
      throw new SearchException(operation + " failed", e);
    }
  }

  /** Maps hits to entities, skipping hits without a source. */
  protected List<T> toEntities(List<Hit<SourceDocument>> hits) {
    List<T> entities = new ArrayList<>(hits.size());
    for (Hit<SourceDocument> hit : hits) {
      SourceDocument source = hit.source();
      if (source != null) {
        entities.add(convertFromDocument(hit.id(), source));
      }
    }
    return entities;
  }

  /**
   * Deletes every stored entity matching the query and waits for the refresh.
   *
   * @return number of deleted entities
   */
  protected long deleteByQuery(Query query) {
    try {
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(query).refresh(true));
      DeleteByQueryResponse response = elasticsearchClient.deleteByQuery(request);
      long deleted = response.deleted() == null ? 0 : response.deleted();
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment(deleted);
      return deleted;
    } catch (IOException e) {
      log.error("Failed to delete from {}: {}", getIndexName(), e.getMessage(), e);
      throw new SearchException("Failed to delete entities", e);
    }
  }

  /** Stored {@code _source} of a hit, deserialized field by field. */
  public static class SourceDocument extends HashMap<String, Object> {
    private static final long serialVersionUID = 1L;
  }
}
