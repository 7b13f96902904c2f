package eu.okaeri.query.filter.predicate.numeric;

import lombok.NonNull;

/**
 * VALUE less than or equal X
 * {@code val <= x}
 */
public class LtePredicate extends ComparisonPredicate {

    public LtePredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }

    @Override
    public boolean results(int compareResult) {
        return compareResult <= 0;
    }
}
