package com.flamingo.ai.resumescreening.index;

import com.flamingo.ai.resumescreening.model.DocumentMetadata;
import com.flamingo.ai.resumescreening.model.IndexStats;
import com.flamingo.ai.resumescreening.model.ResumeChunk;
import com.flamingo.ai.resumescreening.model.ResumeDocument;
import com.flamingo.ai.resumescreening.model.RetrievalHit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Persistent store of resume chunks with their embeddings.
 *
 * <p>Documents are written and deleted as whole units; an existing chunk is never modified in
 * place. Recognised filter keys for {@link #query} are {@link #FILTER_DOCUMENT_ID} and {@link
 * #FILTER_FILENAME}.
 */
public interface VectorIndex {

  String FILTER_DOCUMENT_ID = "documentId";
  String FILTER_FILENAME = "filename";

  /**
   * Stores all chunks of one document.
   *
   * @param documentId the document id
   * @param chunks chunk texts in ordinal order
   * @param embeddings one embedding per chunk
   * @param metadata metadata copied onto every chunk
   * @throws com.flamingo.ai.resumescreening.exception.ArityMismatchException if counts differ
   * @throws com.flamingo.ai.resumescreening.exception.EmptyBatchException if either list is empty
   */
  void upsert(
      String documentId,
      List<String> chunks,
      List<List<Float>> embeddings,
      DocumentMetadata metadata);

  /**
   * Nearest-neighbour search.
   *
   * @param embedding query vector
   * @param topK maximum number of hits
   * @param filter optional equality filter on metadata; {@code null} or empty for none
   * @return hits, best match first
   */
  List<RetrievalHit> query(List<Float> embedding, int topK, Map<String, Object> filter);

  /**
   * Returns every chunk of a document without embeddings.
   *
   * @param documentId the document id
   * @return chunks sorted by ordinal; empty for an unknown id
   */
  List<ResumeChunk> getChunks(String documentId);

  /**
   * Deletes all chunks of a document. Deleting an unknown id succeeds.
   *
   * @param documentId the document id
   */
  void delete(String documentId);

  /** Returns the ids of all stored documents, in no particular order. */
  Set<String> listDocumentIds();

  /**
   * Case-insensitive keyword search over chunk text.
   *
   * @param keyword the keyword
   * @param limit maximum number of chunks
   * @return matching chunks without embeddings
   */
  List<ResumeChunk> searchText(String keyword, int limit);

  /** Short name of the implementation, reported in stats. */
  String type();

  /** Lists stored documents sorted by id, rebuilt from their chunks' shared metadata. */
  default List<ResumeDocument> listDocuments() {
    List<ResumeDocument> documents = new ArrayList<>();
    for (String documentId : listDocumentIds().stream().sorted().toList()) {
      List<ResumeChunk> chunks = getChunks(documentId);
      if (chunks.isEmpty()) {
        continue;
      }
      ResumeChunk first = chunks.get(0);
      documents.add(
          new ResumeDocument(
              documentId,
              first.getFilename(),
              first.getPageCount(),
              first.getIngestedAt(),
              chunks.size()));
    }
    return documents;
  }

  default IndexStats stats() {
    List<ResumeDocument> documents = listDocuments();
    long totalChunks = documents.stream().mapToLong(ResumeDocument::chunkCount).sum();
    return new IndexStats(documents.size(), totalChunks, type());
  }
}
