package dk.cloudcreate.essentials.statebased.store.postgresql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dk.cloudcreate.essentials.shared.Exceptions;
import dk.cloudcreate.essentials.statebased.store.*;
import org.jdbi.v3.core.*;
import org.jdbi.v3.core.statement.SqlStatement;
import org.slf4j.*;

import java.sql.SQLException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link DocumentStore} that keeps each collection in its own Postgresql table with the layout:
 * <pre>{@code
 * CREATE TABLE IF NOT EXISTS {collection_name} (
 *     id       TEXT NOT NULL PRIMARY KEY,
 *     document JSONB NOT NULL
 * )
 * }</pre>
 * The table is created the first time the collection is used.<br>
 * {@link DocumentFilter}'s are translated into SQL and evaluated by Postgresql, and
 * {@link #replace(CollectionName, String, DocumentFilter, Map)} is a single conditional <code>UPDATE</code>, which makes it atomic.<br>
 * Filter values are converted to JSON and compared with the stored value as <code>jsonb</code> (<code>document #> path</code>), so numbers
 * match by numeric value (<code>3</code> matches <code>3.0</code>) while the number <code>3</code> and the string <code>"3"</code> never match each other.<br>
 * The collection name is used as table name and must be a valid unquoted Postgresql identifier.
 */
public class PostgresqlDocumentStore implements DocumentStore {
    private static final Logger  log                       = LoggerFactory.getLogger(PostgresqlDocumentStore.class);
    private static final Pattern VALID_TABLE_NAME          = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]{0,62}");
    private static final String  UNIQUE_VIOLATION_SQLSTATE = "23505";

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final Jdbi         jdbi;
    private final ObjectMapper objectMapper;
    /**
     * The collections whose table is known to exist
     */
    private final Set<CollectionName> initializedCollections = ConcurrentHashMap.newKeySet();

    public PostgresqlDocumentStore(Jdbi jdbi) {
        this(jdbi, createDefaultObjectMapper());
    }

    public PostgresqlDocumentStore(Jdbi jdbi, ObjectMapper objectMapper) {
        this.jdbi = requireNonNull(jdbi, "You must supply a jdbi instance");
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
    }

    public static ObjectMapper createDefaultObjectMapper() {
        return JsonMapper.builder()
                         .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                         .build();
    }

    @Override
    public Optional<Map<String, Object>> findById(CollectionName collectionName, String id) {
        requireNonNull(id, "No id provided");
        var tableName = resolveTable(collectionName);
        var json = execute(collectionName, "findById", handle -> handle.createQuery("SELECT document::text FROM " + tableName + " WHERE id = :id")
                                                                       .bind("id", id)
                                                                       .mapTo(String.class)
                                                                       .findOne());
        return json.map(value -> toDocument(collectionName, value));
    }

    @Override
    public List<Map<String, Object>> find(CollectionName collectionName, DocumentFilter filter) {
        requireNonNull(filter, "No filter provided");
        var tableName   = resolveTable(collectionName);
        var whereClause = new SqlWhereClause(filter);
        var jsonDocuments = execute(collectionName, "find", handle -> {
            var query = handle.createQuery("SELECT document::text FROM " + tableName + " WHERE " + whereClause.sql + " ORDER BY id");
            whereClause.bindTo(query);
            return query.mapTo(String.class)
                        .list();
        });
        var documents = new ArrayList<Map<String, Object>>(jsonDocuments.size());
        for (String json : jsonDocuments) {
            documents.add(toDocument(collectionName, json));
        }
        log.trace("[{}] Found {} document(s) matching {}", collectionName, documents.size(), filter);
        return documents;
    }

    @Override
    public void insert(CollectionName collectionName, String id, Map<String, Object> document) {
        requireNonNull(id, "No id provided");
        requireNonNull(document, "No document provided");
        var tableName = resolveTable(collectionName);
        var json      = toJson(collectionName, document);
        try {
            jdbi.useTransaction(handle -> handle.createUpdate("INSERT INTO " + tableName + " (id, document) VALUES (:id, CAST(:document AS jsonb))")
                                                .bind("id", id)
                                                .bind("document", json)
                                                .execute());
        } catch (JdbiException e) {
            if (isUniqueViolation(e)) {
                throw new DuplicateDocumentException(collectionName, id, e);
            }
            throw new DocumentStoreException(msg("[{}] Failed to insert document with id '{}'", collectionName, id), e);
        }
        log.trace("[{}] Inserted document with id '{}'", collectionName, id);
    }

    @Override
    public boolean replace(CollectionName collectionName, String id, DocumentFilter condition, Map<String, Object> document) {
        requireNonNull(id, "No id provided");
        requireNonNull(condition, "No condition provided");
        requireNonNull(document, "No document provided");
        var tableName   = resolveTable(collectionName);
        var json        = toJson(collectionName, document);
        var whereClause = new SqlWhereClause(condition);
        int rowsUpdated = execute(collectionName, "replace", handle -> handle.inTransaction(transaction -> {
            var update = transaction.createUpdate("UPDATE " + tableName + " SET document = CAST(:document AS jsonb) WHERE id = :id AND " + whereClause.sql)
                                    .bind("id", id)
                                    .bind("document", json);
            whereClause.bindTo(update);
            return update.execute();
        }));
        log.trace("[{}] Replace of document with id '{}' updated {} row(s)", collectionName, id, rowsUpdated);
        return rowsUpdated == 1;
    }

    @Override
    public boolean delete(CollectionName collectionName, String id) {
        requireNonNull(id, "No id provided");
        var tableName = resolveTable(collectionName);
        int rowsDeleted = execute(collectionName, "delete", handle -> handle.inTransaction(transaction -> transaction.createUpdate("DELETE FROM " + tableName + " WHERE id = :id")
                                                                                                                       .bind("id", id)
                                                                                                                       .execute()));
        return rowsDeleted == 1;
    }

    @Override
    public boolean exists(CollectionName collectionName, String id) {
        requireNonNull(id, "No id provided");
        var tableName = resolveTable(collectionName);
        return execute(collectionName, "exists", handle -> handle.createQuery("SELECT count(*) FROM " + tableName + " WHERE id = :id")
                                                                 .bind("id", id)
                                                                 .mapTo(Long.class)
                                                                 .one() > 0);
    }

    /**
     * Validate the collection name and create its table if it hasn't been created by this store yet
     *
     * @return the table name
     */
    private String resolveTable(CollectionName collectionName) {
        requireNonNull(collectionName, "No collectionName provided");
        var tableName = collectionName.toString();
        if (!VALID_TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException(msg("Collection name '{}' isn't a valid Postgresql table name", collectionName));
        }
        if (!initializedCollections.contains(collectionName)) {
            execute(collectionName, "createTable", handle -> {
                handle.useTransaction(transaction -> transaction.execute("CREATE TABLE IF NOT EXISTS " + tableName + " (\n" +
                                                                                 "id TEXT NOT NULL,\n" +
                                                                                 "document JSONB NOT NULL,\n" +
                                                                                 "PRIMARY KEY (id)\n" +
                                                                                 ")"));
                return null;
            });
            initializedCollections.add(collectionName);
            log.info("[{}] Ensured that the '{}' document table exists", collectionName, tableName);
        }
        return tableName;
    }

    private <R> R execute(CollectionName collectionName, String operation, HandleCallback<R, RuntimeException> callback) {
        try {
            return jdbi.withHandle(callback);
        } catch (JdbiException e) {
            throw new DocumentStoreException(msg("[{}] {} failed: {}", collectionName, operation, Exceptions.getRootCause(e).getMessage()), e);
        }
    }

    private static boolean isUniqueViolation(JdbiException e) {
        var cause = Exceptions.getRootCause(e);
        if (cause instanceof SQLException && UNIQUE_VIOLATION_SQLSTATE.equals(((SQLException) cause).getSQLState())) {
            return true;
        }
        return cause.getMessage() != null && cause.getMessage().contains("duplicate key value violates unique constraint");
    }

    private String toJson(CollectionName collectionName, Map<String, Object> document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new DocumentStoreException(msg("[{}] Failed to convert document to JSON", collectionName), e);
        }
    }

    private Map<String, Object> toDocument(CollectionName collectionName, String json) {
        try {
            return objectMapper.readValue(json, DOCUMENT_TYPE);
        } catch (JsonProcessingException e) {
            throw new DocumentStoreException(msg("[{}] Failed to read stored document", collectionName), e);
        }
    }

    /**
     * SQL rendition of a {@link DocumentFilter}, using numbered named parameters
     */
    private final class SqlWhereClause {
        private final String              sql;
        private final Map<String, String> parameters = new LinkedHashMap<>();

        private SqlWhereClause(DocumentFilter filter) {
            if (filter.isEmpty()) {
                sql = "TRUE";
                return;
            }
            var predicates = new ArrayList<String>();
            for (DocumentFilter.Criterion criterion : filter.criteria()) {
                predicates.add(toPredicate(criterion));
            }
            sql = String.join(" AND ", predicates);
        }

        private String toPredicate(DocumentFilter.Criterion criterion) {
            var path      = addParameter(toTextArrayLiteral(criterion.fieldPath));
            var textValue = "(document #>> CAST(:" + path + " AS text[]))";
            var jsonValue = "(document #> CAST(:" + path + " AS text[]))";
            switch (criterion.operator) {
                case EQUALS:
                    return valuePredicate(textValue, jsonValue, criterion.value());
                case IN:
                    return anyOf(textValue, jsonValue, criterion.values);
                case NOT_IN:
                    if (criterion.values.isEmpty()) {
                        return "TRUE";
                    }
                    return "(" + textValue + " IS NULL OR NOT " + anyOf(textValue, jsonValue, criterion.values) + ")";
                default:
                    throw new IllegalArgumentException(msg("Unsupported operator '{}'", criterion.operator));
            }
        }

        private String anyOf(String textValue, String jsonValue, List<Object> values) {
            if (values.isEmpty()) {
                return "FALSE";
            }
            var predicates = new ArrayList<String>(values.size());
            for (Object value : values) {
                predicates.add(valuePredicate(textValue, jsonValue, value));
            }
            return "(" + String.join(" OR ", predicates) + ")";
        }

        private String valuePredicate(String textValue, String jsonValue, Object value) {
            if (value == null) {
                return textValue + " IS NULL";
            }
            return jsonValue + " = CAST(:" + addParameter(toJsonValue(value)) + " AS jsonb)";
        }

        private String addParameter(String value) {
            var name = "p" + parameters.size();
            parameters.put(name, value);
            return name;
        }

        private void bindTo(SqlStatement<?> statement) {
            parameters.forEach((name, value) -> statement.bind(name, value));
        }
    }

    private String toJsonValue(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DocumentStoreException(msg("Failed to convert filter value '{}' to JSON", value), e);
        }
    }

    /**
     * Convert a dotted field path into a Postgresql text array literal, e.g. <code>address.zip_code</code> becomes <code>{"address","zip_code"}</code>
     */
    static String toTextArrayLiteral(String fieldPath) {
        var elements = new StringJoiner(",", "{", "}");
        for (String fieldName : fieldPath.split("\\.")) {
            elements.add("\"" + fieldName.replace("\\", "\\\\").replace("\"", "\\\"") + "\"");
        }
        return elements.toString();
    }
}
