package eu.okaeri.query.filter.predicate.collection;

import eu.okaeri.query.filter.predicate.SimplePredicate;
import lombok.NonNull;

import java.util.Collection;

import static eu.okaeri.query.value.ValueUtils.compareEquals;

/**
 * VALUE in collection
 * {@code val in [x, y, z]}
 */
public class InPredicate extends SimplePredicate {

    public InPredicate(@NonNull Collection<?> values) {
        super(values);
    }

    @Override
    public boolean check(Object leftOperand) {
        Collection<?> collection = (Collection<?>) this.getRightOperand();
        return collection.stream().anyMatch(value -> compareEquals(leftOperand, value));
    }
}
