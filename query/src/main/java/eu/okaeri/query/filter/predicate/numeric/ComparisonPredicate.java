package eu.okaeri.query.filter.predicate.numeric;

import eu.okaeri.query.filter.predicate.SimplePredicate;
import lombok.NonNull;

import static eu.okaeri.query.value.ValueUtils.compareOrdered;

/**
 * Ordering predicate. Values without a common order with the operand
 * (absent fields, booleans against numbers, ...) never match.
 */
public abstract class ComparisonPredicate extends SimplePredicate {

    protected ComparisonPredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }

    @Override
    public boolean check(Object leftOperand) {
        Integer compareResult = compareOrdered(leftOperand, this.getRightOperand());
        return (compareResult != null) && this.results(compareResult);
    }

    public abstract boolean results(int compareResult);
}
