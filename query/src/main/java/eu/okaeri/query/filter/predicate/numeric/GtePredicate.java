package eu.okaeri.query.filter.predicate.numeric;

import lombok.NonNull;

/**
 * VALUE greater than or equal X
 * {@code val >= x}
 */
public class GtePredicate extends ComparisonPredicate {

    public GtePredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }

    @Override
    public boolean results(int compareResult) {
        return compareResult >= 0;
    }
}
