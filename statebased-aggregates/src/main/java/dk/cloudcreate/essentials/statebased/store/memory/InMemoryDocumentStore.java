package dk.cloudcreate.essentials.statebased.store.memory;

import dk.cloudcreate.essentials.statebased.store.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Thread safe in-memory {@link DocumentStore}. Documents are copied on the way in and out,
 * and each collection is guarded by its own monitor which makes conditional replaces atomic.<br>
 * {@link #find(CollectionName, DocumentFilter)} returns documents in insertion order.
 */
public class InMemoryDocumentStore implements DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final ConcurrentMap<CollectionName, Map<String, Map<String, Object>>> collections = new ConcurrentHashMap<>();

    private Map<String, Map<String, Object>> collection(CollectionName collectionName) {
        requireNonNull(collectionName, "No collectionName provided");
        return collections.computeIfAbsent(collectionName, name -> {
            log.debug("[{}] Creating in-memory collection", name);
            return new LinkedHashMap<>();
        });
    }

    @Override
    public Optional<Map<String, Object>> findById(CollectionName collectionName, String id) {
        requireNonNull(id, "No id provided");
        var documents = collection(collectionName);
        synchronized (documents) {
            return Optional.ofNullable(documents.get(id))
                           .map(Documents::deepCopy);
        }
    }

    @Override
    public List<Map<String, Object>> find(CollectionName collectionName, DocumentFilter filter) {
        requireNonNull(filter, "No filter provided");
        var documents = collection(collectionName);
        var result    = new ArrayList<Map<String, Object>>();
        synchronized (documents) {
            for (Map<String, Object> document : documents.values()) {
                if (filter.matches(document)) {
                    result.add(Documents.deepCopy(document));
                }
            }
        }
        log.trace("[{}] Found {} document(s) matching {}", collectionName, result.size(), filter);
        return result;
    }

    @Override
    public void insert(CollectionName collectionName, String id, Map<String, Object> document) {
        requireNonNull(id, "No id provided");
        requireNonNull(document, "No document provided");
        var documents = collection(collectionName);
        synchronized (documents) {
            if (documents.containsKey(id)) {
                throw new DuplicateDocumentException(collectionName, id);
            }
            documents.put(id, Documents.deepCopy(document));
        }
        log.trace("[{}] Inserted document with id '{}'", collectionName, id);
    }

    @Override
    public boolean replace(CollectionName collectionName, String id, DocumentFilter condition, Map<String, Object> document) {
        requireNonNull(id, "No id provided");
        requireNonNull(condition, "No condition provided");
        requireNonNull(document, "No document provided");
        var documents = collection(collectionName);
        synchronized (documents) {
            var current = documents.get(id);
            if (current == null || !condition.matches(current)) {
                log.trace("[{}] No document with id '{}' matched {}", collectionName, id, condition);
                return false;
            }
            documents.put(id, Documents.deepCopy(document));
        }
        log.trace("[{}] Replaced document with id '{}'", collectionName, id);
        return true;
    }

    @Override
    public boolean delete(CollectionName collectionName, String id) {
        requireNonNull(id, "No id provided");
        var documents = collection(collectionName);
        synchronized (documents) {
            return documents.remove(id) != null;
        }
    }

    /**
     * Remove all documents in all collections
     */
    public void clear() {
        collections.clear();
    }
}
