package eu.okaeri.query.filter.predicate.collection;

import eu.okaeri.query.filter.predicate.SimplePredicate;
import eu.okaeri.query.value.ValueUtils;
import lombok.NonNull;

import java.util.Collection;
import java.util.List;

import static eu.okaeri.query.value.ValueUtils.compareEquals;

/**
 * Array field shares at least one element with collection
 * {@code val[] & [x, y, z] != []}
 */
public class ArrayContainsAnyPredicate extends SimplePredicate {

    public ArrayContainsAnyPredicate(@NonNull Collection<?> values) {
        super(values);
    }

    @Override
    public boolean check(Object leftOperand) {
        List<Object> elements = ValueUtils.asList(leftOperand);
        if (elements == null) {
            return false;
        }
        Collection<?> candidates = (Collection<?>) this.getRightOperand();
        return elements.stream().anyMatch(element -> candidates.stream().anyMatch(candidate -> compareEquals(element, candidate)));
    }
}
