package dk.cloudcreate.essentials.statebased.store;

import dk.cloudcreate.essentials.types.CharSequenceType;

/**
 * The name of the collection (table, folder, ...) that the documents of one aggregate type are stored in.<br>
 * The collection name is supplied by the repository configuration and is never stored inside the documents.<br>
 * Example: the state of <b>Order</b> aggregates could be stored in the collection named <b>orders</b>
 */
public class CollectionName extends CharSequenceType<CollectionName> {
    public CollectionName(CharSequence value) {
        super(value);
    }

    public static CollectionName of(CharSequence value) {
        return new CollectionName(value);
    }
}
