package eu.okaeri.query.filter.predicate.numeric;

import lombok.NonNull;

/**
 * VALUE less than X
 * {@code val < x}
 */
public class LtPredicate extends ComparisonPredicate {

    public LtPredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }

    @Override
    public boolean results(int compareResult) {
        return compareResult < 0;
    }
}
