package dk.cloudcreate.essentials.statebased.aggregates;

import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Base class for the persisted state of a {@link StateAggregateRoot}.<br>
 * Subclasses add the business fields as plain (non-transient) fields. The state never holds pending events
 * and contains no behaviour beyond simple accessors, all business rules live in the aggregate.<br>
 * <br>
 * Persisted form (snake_case):
 * <pre>{@code
 * {
 *   "id": "...",
 *   "state_version": 3,
 *   "created_at": "2024-01-01T10:00:00Z",
 *   "last_modified": "2024-01-01T10:05:00Z",
 *   ...business fields
 * }
 * }</pre>
 * The repository owns {@link #stateVersion()}, {@link #createdAt()} and {@link #lastModified()}.
 *
 * @param <ID> the type of aggregate id
 */
public abstract class AggregateState<ID> implements Identifiable<ID> {
    public static final String ID_FIELD            = "id";
    public static final String STATE_VERSION_FIELD = "state_version";
    public static final String CREATED_AT_FIELD    = "created_at";
    public static final String LAST_MODIFIED_FIELD = "last_modified";

    private ID             id;
    private long           stateVersion;
    private OffsetDateTime createdAt;
    private OffsetDateTime lastModified;

    /**
     * Key: JSON pointer to the persisted value, e.g. <code>/created_at</code> or <code>/slot/starts_at</code><br>
     * Value: the raw text of a timestamp value that couldn't be parsed when the state was deserialized
     */
    private final transient Map<String, String> unparsedValues = new LinkedHashMap<>();

    /**
     * Used for deserialization
     */
    protected AggregateState() {
    }

    protected AggregateState(ID id) {
        this.id = requireNonNull(id, "No id provided");
    }

    @Override
    public ID aggregateId() {
        return id;
    }

    /**
     * Number of successful updates persisted for this state. 0 means the state has only been added (or never persisted)
     */
    public long stateVersion() {
        return stateVersion;
    }

    public OffsetDateTime createdAt() {
        return createdAt;
    }

    public OffsetDateTime lastModified() {
        return lastModified;
    }

    /**
     * Set the creation timestamp. The creation timestamp can only be set once, any later call is ignored
     *
     * @param timestamp the creation timestamp
     */
    public void markCreated(OffsetDateTime timestamp) {
        requireNonNull(timestamp, "No timestamp provided");
        if (createdAt == null) {
            createdAt = timestamp.withOffsetSameInstant(ZoneOffset.UTC);
            unparsedValues.remove("/" + CREATED_AT_FIELD);
        }
    }

    /**
     * Set the last modified timestamp
     *
     * @param timestamp the modification timestamp
     */
    public void markModified(OffsetDateTime timestamp) {
        requireNonNull(timestamp, "No timestamp provided");
        lastModified = timestamp.withOffsetSameInstant(ZoneOffset.UTC);
        unparsedValues.remove("/" + LAST_MODIFIED_FIELD);
    }

    /**
     * Set the state version. Only intended to be called by the repository after a successful write
     *
     * @param stateVersion the persisted state version
     */
    public void assignStateVersion(long stateVersion) {
        if (stateVersion < 0) {
            throw new IllegalArgumentException("stateVersion must be 0 or larger");
        }
        this.stateVersion = stateVersion;
    }

    /**
     * Remember the raw text of a persisted value that couldn't be parsed, so it can be written back unchanged
     *
     * @param jsonPointer JSON pointer to the value inside the persisted state, e.g. <code>/items/0/shipped_at</code>
     * @param rawValue    the raw value
     */
    public void retainUnparsedValue(String jsonPointer, String rawValue) {
        requireNonNull(jsonPointer, "No jsonPointer provided");
        requireNonNull(rawValue, "No rawValue provided");
        unparsedValues.put(jsonPointer, rawValue);
    }

    /**
     * Raw values that couldn't be parsed during deserialization
     *
     * @return the raw values keyed by JSON pointer
     */
    public Map<String, String> unparsedValues() {
        return Collections.unmodifiableMap(unparsedValues);
    }
}
