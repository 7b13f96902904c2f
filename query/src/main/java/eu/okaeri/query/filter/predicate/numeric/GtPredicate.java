package eu.okaeri.query.filter.predicate.numeric;

import lombok.NonNull;

/**
 * VALUE greater than X
 * {@code val > x}
 */
public class GtPredicate extends ComparisonPredicate {

    public GtPredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }

    @Override
    public boolean results(int compareResult) {
        return compareResult > 0;
    }
}
