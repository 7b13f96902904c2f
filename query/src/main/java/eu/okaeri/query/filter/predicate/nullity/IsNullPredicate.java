package eu.okaeri.query.filter.predicate.nullity;

import eu.okaeri.query.filter.predicate.Predicate;

/**
 * VALUE is null or absent
 * {@code val == null}
 */
public class IsNullPredicate implements Predicate {

    @Override
    public boolean check(Object leftOperand) {
        return leftOperand == null;
    }
}
