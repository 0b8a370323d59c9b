package dk.cloudcreate.essentials.statebased.store;

import java.util.*;

/**
 * Storage SPI used by the state repository. A document store keeps JSON compatible documents
 * (maps of String, Number, Boolean, List, Map or null values) keyed by id, grouped into collections.<br>
 * Implementations must be safe for concurrent use and {@link #replace(CollectionName, String, DocumentFilter, Map)}
 * must be atomic: compare and write happen as one step, so two concurrent conditional replaces of the same
 * document can never both succeed.<br>
 * Storage failures are reported as {@link DocumentStoreException}
 */
public interface DocumentStore {
    /**
     * Find the document with the given id
     *
     * @param collectionName the collection
     * @param id             the document id
     * @return the document or {@link Optional#empty()} if no document with the given id exists
     */
    Optional<Map<String, Object>> findById(CollectionName collectionName, String id);

    /**
     * Find all documents matching the filter. The filter is evaluated by the store, not by the caller
     *
     * @param collectionName the collection
     * @param filter         the filter ({@link DocumentFilter#all()} matches all documents)
     * @return the matching documents
     */
    List<Map<String, Object>> find(CollectionName collectionName, DocumentFilter filter);

    /**
     * Insert a new document
     *
     * @param collectionName the collection
     * @param id             the document id
     * @param document       the document
     * @throws DuplicateDocumentException if a document with the given id already exists
     */
    void insert(CollectionName collectionName, String id, Map<String, Object> document);

    /**
     * Atomically replace the document with the given id, but only if the currently stored document matches the <code>condition</code>
     *
     * @param collectionName the collection
     * @param id             the document id
     * @param condition      the condition the stored document must match
     * @param document       the new document
     * @return true if a document matched and was replaced, false if no document matched (missing or condition not fulfilled)
     */
    boolean replace(CollectionName collectionName, String id, DocumentFilter condition, Map<String, Object> document);

    /**
     * Delete the document with the given id
     *
     * @param collectionName the collection
     * @param id             the document id
     * @return true if a document was deleted
     */
    boolean delete(CollectionName collectionName, String id);

    /**
     * Does a document with the given id exist
     */
    default boolean exists(CollectionName collectionName, String id) {
        return findById(collectionName, id).isPresent();
    }
}
