package eu.okaeri.query.filter.predicate.collection;

import eu.okaeri.query.filter.predicate.SimplePredicate;
import lombok.NonNull;

import java.util.Collection;

import static eu.okaeri.query.value.ValueUtils.compareEquals;

/**
 * VALUE not in collection, absent values included
 * {@code val not in [x, y, z]}
 */
public class NotInPredicate extends SimplePredicate {

    public NotInPredicate(@NonNull Collection<?> values) {
        super(values);
    }

    @Override
    public boolean check(Object leftOperand) {
        Collection<?> collection = (Collection<?>) this.getRightOperand();
        return collection.stream().noneMatch(value -> compareEquals(leftOperand, value));
    }
}
