package dk.cloudcreate.essentials.statebased.store.filesystem;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dk.cloudcreate.essentials.statebased.store.*;
import org.slf4j.*;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link DocumentStore} that keeps each collection in its own directory below a root directory,
 * with one <code>&lt;id&gt;.json</code> file per document.<br>
 * All operations on a collection are serialized through a per collection lock, and files are
 * written to a temporary file that's moved into place, so a reader never sees a partially written document.<br>
 * The lock only guards this JVM, the directory must not be shared between processes.
 */
public class FileSystemDocumentStore implements DocumentStore {
    private static final Logger                              log           = LoggerFactory.getLogger(FileSystemDocumentStore.class);
    private static final String                              FILE_SUFFIX   = ".json";
    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final Path                                          rootDirectory;
    private final ObjectMapper                                  objectMapper;
    private final ConcurrentMap<CollectionName, ReentrantLock> collectionLocks = new ConcurrentHashMap<>();

    public FileSystemDocumentStore(Path rootDirectory) {
        this(rootDirectory,
             JsonMapper.builder()
                       .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                       .enable(SerializationFeature.INDENT_OUTPUT)
                       .build());
    }

    public FileSystemDocumentStore(Path rootDirectory, ObjectMapper objectMapper) {
        this.rootDirectory = requireNonNull(rootDirectory, "No rootDirectory provided");
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
        try {
            Files.createDirectories(rootDirectory);
        } catch (IOException e) {
            throw new DocumentStoreException(msg("Failed to create root directory '{}'", rootDirectory), e);
        }
        log.info("Using '{}' as root directory for document collections", rootDirectory.toAbsolutePath());
    }

    @Override
    public Optional<Map<String, Object>> findById(CollectionName collectionName, String id) {
        requireNonNull(id, "No id provided");
        return withLock(collectionName, () -> {
            var documentFile = documentFile(collectionName, id);
            if (!Files.exists(documentFile)) {
                return Optional.empty();
            }
            return Optional.of(readDocument(collectionName, documentFile));
        });
    }

    @Override
    public List<Map<String, Object>> find(CollectionName collectionName, DocumentFilter filter) {
        requireNonNull(filter, "No filter provided");
        return withLock(collectionName, () -> {
            var directory = collectionDirectory(collectionName);
            if (!Files.isDirectory(directory)) {
                return List.of();
            }
            List<Path> documentFiles;
            try (var files = Files.list(directory)) {
                documentFiles = files.filter(file -> file.getFileName().toString().endsWith(FILE_SUFFIX))
                                     .sorted()
                                     .collect(Collectors.toList());
            } catch (IOException e) {
                throw new DocumentStoreException(msg("[{}] Failed to list documents in '{}'", collectionName, directory), e);
            }
            var result = new ArrayList<Map<String, Object>>();
            for (Path documentFile : documentFiles) {
                var document = readDocument(collectionName, documentFile);
                if (filter.matches(document)) {
                    result.add(document);
                }
            }
            log.trace("[{}] Found {} document(s) matching {}", collectionName, result.size(), filter);
            return result;
        });
    }

    @Override
    public void insert(CollectionName collectionName, String id, Map<String, Object> document) {
        requireNonNull(id, "No id provided");
        requireNonNull(document, "No document provided");
        withLock(collectionName, () -> {
            var documentFile = documentFile(collectionName, id);
            if (Files.exists(documentFile)) {
                throw new DuplicateDocumentException(collectionName, id);
            }
            writeDocument(collectionName, documentFile, document);
            log.trace("[{}] Inserted document with id '{}' into '{}'", collectionName, id, documentFile);
            return null;
        });
    }

    @Override
    public boolean replace(CollectionName collectionName, String id, DocumentFilter condition, Map<String, Object> document) {
        requireNonNull(id, "No id provided");
        requireNonNull(condition, "No condition provided");
        requireNonNull(document, "No document provided");
        return withLock(collectionName, () -> {
            var documentFile = documentFile(collectionName, id);
            if (!Files.exists(documentFile) || !condition.matches(readDocument(collectionName, documentFile))) {
                log.trace("[{}] No document with id '{}' matched {}", collectionName, id, condition);
                return false;
            }
            writeDocument(collectionName, documentFile, document);
            log.trace("[{}] Replaced document with id '{}'", collectionName, id);
            return true;
        });
    }

    @Override
    public boolean delete(CollectionName collectionName, String id) {
        requireNonNull(id, "No id provided");
        return withLock(collectionName, () -> {
            try {
                return Files.deleteIfExists(documentFile(collectionName, id));
            } catch (IOException e) {
                throw new DocumentStoreException(msg("[{}] Failed to delete document with id '{}'", collectionName, id), e);
            }
        });
    }

    private <R> R withLock(CollectionName collectionName, Callable<R> operation) {
        requireNonNull(collectionName, "No collectionName provided");
        var lock = collectionLocks.computeIfAbsent(collectionName, name -> new ReentrantLock());
        lock.lock();
        try {
            return operation.call();
        } catch (DocumentStoreException e) {
            throw e;
        } catch (Exception e) {
            throw new DocumentStoreException(msg("[{}] Document store operation failed", collectionName), e);
        } finally {
            lock.unlock();
        }
    }

    private Path collectionDirectory(CollectionName collectionName) {
        return rootDirectory.resolve(collectionName.toString());
    }

    private Path documentFile(CollectionName collectionName, String id) {
        return collectionDirectory(collectionName).resolve(URLEncoder.encode(id, StandardCharsets.UTF_8) + FILE_SUFFIX);
    }

    private Map<String, Object> readDocument(CollectionName collectionName, Path documentFile) {
        try {
            return objectMapper.readValue(documentFile.toFile(), DOCUMENT_TYPE);
        } catch (IOException e) {
            throw new DocumentStoreException(msg("[{}] Failed to read document '{}'", collectionName, documentFile), e);
        }
    }

    private void writeDocument(CollectionName collectionName, Path documentFile, Map<String, Object> document) {
        try {
            Files.createDirectories(documentFile.getParent());
            var temporaryFile = Files.createTempFile(documentFile.getParent(), "tmp-", ".partial");
            try {
                objectMapper.writeValue(temporaryFile.toFile(), document);
                moveIntoPlace(temporaryFile, documentFile);
            } finally {
                Files.deleteIfExists(temporaryFile);
            }
        } catch (IOException e) {
            throw new DocumentStoreException(msg("[{}] Failed to write document '{}'", collectionName, documentFile), e);
        }
    }

    private static void moveIntoPlace(Path temporaryFile, Path documentFile) throws IOException {
        try {
            Files.move(temporaryFile, documentFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move isn't supported for '{}', falling back to a regular move", documentFile);
            Files.move(temporaryFile, documentFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
