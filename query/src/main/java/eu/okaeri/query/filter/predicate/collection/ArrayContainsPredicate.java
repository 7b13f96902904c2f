package eu.okaeri.query.filter.predicate.collection;

import eu.okaeri.query.filter.predicate.SimplePredicate;
import eu.okaeri.query.value.ValueUtils;

import java.util.List;

import static eu.okaeri.query.value.ValueUtils.compareEquals;

/**
 * Array field contains X
 * {@code x in val[]}
 */
public class ArrayContainsPredicate extends SimplePredicate {

    public ArrayContainsPredicate(Object element) {
        super(element);
    }

    @Override
    public boolean check(Object leftOperand) {
        List<Object> elements = ValueUtils.asList(leftOperand);
        return (elements != null) && elements.stream().anyMatch(element -> compareEquals(element, this.getRightOperand()));
    }
}
