package dk.cloudcreate.essentials.statebased.repository;

import dk.cloudcreate.essentials.statebased.aggregates.AggregateException;
import dk.cloudcreate.essentials.statebased.store.CollectionName;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class AggregateNotFoundException extends AggregateException {
    public final Object         aggregateId;
    public final Class<?>       aggregateType;
    public final CollectionName collectionName;

    public AggregateNotFoundException(Object aggregateId, Class<?> aggregateType, CollectionName collectionName) {
        super(generateMessage(aggregateId, aggregateType, collectionName));
        this.aggregateId = requireNonNull(aggregateId, "You must supply an aggregateId");
        this.aggregateType = requireNonNull(aggregateType, "You must supply an aggregateType");
        this.collectionName = requireNonNull(collectionName, "You must supply a collectionName");
    }

    private static String generateMessage(Object aggregateId, Class<?> aggregateType, CollectionName collectionName) {
        return msg("Couldn't find a '{}' aggregate with Id '{}' in the collection '{}'",
                   aggregateType.getName(),
                   aggregateId,
                   collectionName);
    }
}
