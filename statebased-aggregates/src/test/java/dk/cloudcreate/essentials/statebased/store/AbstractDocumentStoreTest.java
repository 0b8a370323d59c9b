package dk.cloudcreate.essentials.statebased.store;

import org.junit.jupiter.api.*;

import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Behaviour every {@link DocumentStore} must provide
 */
public abstract class AbstractDocumentStoreTest<STORE extends DocumentStore> {
    protected static final CollectionName ORDERS = CollectionName.of("orders");

    protected STORE documentStore;

    protected abstract STORE createDocumentStore();

    @BeforeEach
    void setupDocumentStore() {
        documentStore = createDocumentStore();
    }

    protected static Map<String, Object> document(Object... keysAndValues) {
        var document = new LinkedHashMap<String, Object>();
        for (int index = 0; index < keysAndValues.length; index += 2) {
            document.put((String) keysAndValues[index], keysAndValues[index + 1]);
        }
        return document;
    }

    @Test
    void verify_that_an_inserted_document_can_be_found_by_id() {
        // Given
        documentStore.insert(ORDERS, "order-1", document("id", "order-1", "status", "pending", "state_version", 0));

        // When
        var found = documentStore.findById(ORDERS, "order-1");

        // Then
        assertThat(found).isPresent();
        assertThat(found.get()).containsEntry("id", "order-1")
                               .containsEntry("status", "pending");
        assertThat(documentStore.exists(ORDERS, "order-1")).isTrue();
        assertThat(documentStore.findById(ORDERS, "order-2")).isEmpty();
        assertThat(documentStore.exists(ORDERS, "order-2")).isFalse();
    }

    @Test
    void verify_that_collections_are_isolated() {
        // Given
        documentStore.insert(ORDERS, "order-1", document("id", "order-1"));

        // When / Then
        assertThat(documentStore.findById(CollectionName.of("customers"), "order-1")).isEmpty();
        assertThat(documentStore.find(CollectionName.of("customers"), DocumentFilter.all())).isEmpty();
    }

    @Test
    void verify_that_inserting_an_existing_id_fails() {
        // Given
        documentStore.insert(ORDERS, "order-1", document("id", "order-1", "status", "pending"));

        // When / Then
        assertThatThrownBy(() -> documentStore.insert(ORDERS, "order-1", document("id", "order-1", "status", "ready")))
                .isInstanceOf(DuplicateDocumentException.class);
        assertThat(documentStore.findById(ORDERS, "order-1").get()).containsEntry("status", "pending");
    }

    @Test
    void verify_that_changing_a_returned_document_does_not_change_the_stored_document() {
        // Given
        documentStore.insert(ORDERS, "order-1", document("id", "order-1", "status", "pending"));

        // When
        documentStore.findById(ORDERS, "order-1").get().put("status", "hacked");

        // Then
        assertThat(documentStore.findById(ORDERS, "order-1").get()).containsEntry("status", "pending");
    }

    @Test
    void verify_that_replace_only_happens_when_the_condition_matches() {
        // Given
        documentStore.insert(ORDERS, "order-1", document("id", "order-1", "status", "pending", "state_version", 0));

        // When
        var staleReplace   = documentStore.replace(ORDERS, "order-1", DocumentFilter.where("state_version", 3L), document("id", "order-1", "status", "ready", "state_version", 4));
        var currentReplace = documentStore.replace(ORDERS, "order-1", DocumentFilter.where("state_version", 0L), document("id", "order-1", "status", "confirmed", "state_version", 1));

        // Then
        assertThat(staleReplace).isFalse();
        assertThat(currentReplace).isTrue();
        var stored = documentStore.findById(ORDERS, "order-1").get();
        assertThat(stored).containsEntry("status", "confirmed");
        assertThat(((Number) stored.get("state_version")).longValue()).isEqualTo(1L);
    }

    @Test
    void verify_that_replacing_a_missing_document_returns_false() {
        assertThat(documentStore.replace(ORDERS, "missing", DocumentFilter.all(), document("id", "missing"))).isFalse();
        assertThat(documentStore.findById(ORDERS, "missing")).isEmpty();
    }

    @Test
    void verify_that_a_condition_including_null_matches_a_document_without_the_field() {
        // Given
        documentStore.insert(ORDERS, "legacy-1", document("type", "OrderState", "state", document("id", "legacy-1")));

        // When
        var replaced = documentStore.replace(ORDERS,
                                             "legacy-1",
                                             DocumentFilter.whereIn("state_version", Arrays.asList(0L, null)),
                                             document("id", "legacy-1", "state_version", 1));

        // Then
        assertThat(replaced).isTrue();
        assertThat(documentStore.findById(ORDERS, "legacy-1").get()).doesNotContainKeys("type", "state");
    }

    @Test
    void verify_that_delete_reports_whether_a_document_was_deleted() {
        // Given
        documentStore.insert(ORDERS, "order-1", document("id", "order-1"));

        // When / Then
        assertThat(documentStore.delete(ORDERS, "order-1")).isTrue();
        assertThat(documentStore.delete(ORDERS, "order-1")).isFalse();
        assertThat(documentStore.findById(ORDERS, "order-1")).isEmpty();
    }

    @Test
    void verify_that_find_evaluates_the_filter() {
        // Given
        documentStore.insert(ORDERS, "order-1", document("id", "order-1", "customer_id", "c-1", "status", "pending", "address", document("zip_code", "8000")));
        documentStore.insert(ORDERS, "order-2", document("id", "order-2", "customer_id", "c-1", "status", "delivered", "address", document("zip_code", "2100")));
        documentStore.insert(ORDERS, "order-3", document("id", "order-3", "customer_id", "c-2", "status", "ready"));

        // When / Then
        assertThat(ids(documentStore.find(ORDERS, DocumentFilter.all()))).containsExactlyInAnyOrder("order-1", "order-2", "order-3");
        assertThat(ids(documentStore.find(ORDERS, DocumentFilter.where("customer_id", "c-1")))).containsExactlyInAnyOrder("order-1", "order-2");
        assertThat(ids(documentStore.find(ORDERS, DocumentFilter.where("customer_id", "c-1")
                                                                .andNotIn("status", List.of("delivered", "cancelled"))))).containsExactly("order-1");
        assertThat(ids(documentStore.find(ORDERS, DocumentFilter.whereIn("status", List.of("ready", "pending"))))).containsExactlyInAnyOrder("order-1", "order-3");
        assertThat(ids(documentStore.find(ORDERS, DocumentFilter.where("address.zip_code", "2100")))).containsExactly("order-2");
        assertThat(ids(documentStore.find(ORDERS, DocumentFilter.where("address", null)))).containsExactly("order-3");
        assertThat(ids(documentStore.find(ORDERS, DocumentFilter.whereNotIn("address.zip_code", List.of("8000"))))).containsExactlyInAnyOrder("order-2", "order-3");
        assertThat(documentStore.find(ORDERS, DocumentFilter.whereIn("status", List.of()))).isEmpty();
        assertThat(documentStore.find(ORDERS, DocumentFilter.where("customer_id", "c-3"))).isEmpty();
    }

    @Test
    void verify_that_numeric_values_match_regardless_of_their_java_type() {
        // Given
        documentStore.insert(ORDERS, "order-1", document("id", "order-1", "state_version", 3));

        // When / Then
        assertThat(documentStore.find(ORDERS, DocumentFilter.where("state_version", 3L))).hasSize(1);
        assertThat(documentStore.find(ORDERS, DocumentFilter.where("state_version", 3))).hasSize(1);
        assertThat(documentStore.find(ORDERS, DocumentFilter.where("state_version", 4L))).isEmpty();
    }

    @Test
    void verify_that_numbers_and_strings_never_match_each_other() {
        // Given
        documentStore.insert(ORDERS, "order-1", document("id", "order-1", "table_number", 3, "zip_code", "8000"));
        documentStore.insert(ORDERS, "order-2", document("id", "order-2", "table_number", "3", "zip_code", 8000));

        // When / Then
        assertThat(ids(documentStore.find(ORDERS, DocumentFilter.where("table_number", 3)))).containsExactly("order-1");
        assertThat(ids(documentStore.find(ORDERS, DocumentFilter.where("table_number", new BigDecimal("3.0"))))).containsExactly("order-1");
        assertThat(ids(documentStore.find(ORDERS, DocumentFilter.where("table_number", "3")))).containsExactly("order-2");
        assertThat(ids(documentStore.find(ORDERS, DocumentFilter.whereIn("zip_code", List.of("8000"))))).containsExactly("order-1");
        assertThat(ids(documentStore.find(ORDERS, DocumentFilter.whereNotIn("zip_code", List.of(8000))))).containsExactly("order-1");
    }

    @Test
    void verify_that_only_one_of_two_concurrent_conditional_replaces_succeeds() throws Exception {
        // Given
        documentStore.insert(ORDERS, "order-1", document("id", "order-1", "state_version", 0));
        var numberOfWriters = 8;
        var executor        = Executors.newFixedThreadPool(numberOfWriters);
        var start           = new CountDownLatch(1);
        var successes       = new AtomicInteger();
        try {
            var futures = new ArrayList<Future<?>>();
            for (int writer = 0; writer < numberOfWriters; writer++) {
                var writerNumber = writer;
                futures.add(executor.submit(() -> {
                    start.await();
                    if (documentStore.replace(ORDERS,
                                              "order-1",
                                              DocumentFilter.where("state_version", 0L),
                                              document("id", "order-1", "state_version", 1, "writer", writerNumber))) {
                        successes.incrementAndGet();
                    }
                    return null;
                }));
            }

            // When
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(successes.get()).isEqualTo(1);
    }

    protected static List<Object> ids(List<Map<String, Object>> documents) {
        var ids = new ArrayList<>();
        for (Map<String, Object> document : documents) {
            ids.add(document.get("id"));
        }
        return ids;
    }
}
