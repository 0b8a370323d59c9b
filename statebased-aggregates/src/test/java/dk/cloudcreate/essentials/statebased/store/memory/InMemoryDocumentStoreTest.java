package dk.cloudcreate.essentials.statebased.store.memory;

import dk.cloudcreate.essentials.statebased.store.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryDocumentStoreTest extends AbstractDocumentStoreTest<InMemoryDocumentStore> {
    @Override
    protected InMemoryDocumentStore createDocumentStore() {
        return new InMemoryDocumentStore();
    }

    @Test
    void verify_that_clear_removes_all_documents() {
        // Given
        documentStore.insert(ORDERS, "order-1", document("id", "order-1"));

        // When
        documentStore.clear();

        // Then
        assertThat(documentStore.find(ORDERS, DocumentFilter.all())).isEmpty();
    }

    @Test
    void verify_that_find_returns_documents_in_insertion_order() {
        // Given
        documentStore.insert(ORDERS, "b", document("id", "b"));
        documentStore.insert(ORDERS, "a", document("id", "a"));
        documentStore.insert(ORDERS, "c", document("id", "c"));

        // When
        var documents = documentStore.find(ORDERS, DocumentFilter.all());

        // Then
        assertThat(ids(documents)).containsExactly("b", "a", "c");
    }
}
