package dk.cloudcreate.essentials.statebased.store;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown by {@link DocumentStore#insert(CollectionName, String, java.util.Map)} if a document with the same id already exists
 */
public class DuplicateDocumentException extends DocumentStoreException {
    public final CollectionName collectionName;
    public final String         documentId;

    public DuplicateDocumentException(CollectionName collectionName, String documentId) {
        super(msg("[{}] A document with id '{}' already exists", collectionName, documentId));
        this.collectionName = collectionName;
        this.documentId = documentId;
    }

    public DuplicateDocumentException(CollectionName collectionName, String documentId, Throwable cause) {
        super(msg("[{}] A document with id '{}' already exists", collectionName, documentId), cause);
        this.collectionName = collectionName;
        this.documentId = documentId;
    }
}
