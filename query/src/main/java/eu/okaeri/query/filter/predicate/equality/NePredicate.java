package eu.okaeri.query.filter.predicate.equality;

import eu.okaeri.query.filter.predicate.SimplePredicate;

/**
 * VALUE not equals X
 * {@code val != x}
 */
public class NePredicate extends SimplePredicate {

    private final EqPredicate equality;

    public NePredicate(Object rightOperand, boolean caseSensitive) {
        super(rightOperand);
        this.equality = new EqPredicate(rightOperand, caseSensitive);
    }

    @Override
    public boolean check(Object leftOperand) {
        return !this.equality.check(leftOperand);
    }
}
