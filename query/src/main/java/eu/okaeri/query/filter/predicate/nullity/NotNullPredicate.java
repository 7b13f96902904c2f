package eu.okaeri.query.filter.predicate.nullity;

import eu.okaeri.query.filter.predicate.Predicate;

/**
 * VALUE is present and not null
 * {@code val != null}
 */
public class NotNullPredicate implements Predicate {

    @Override
    public boolean check(Object leftOperand) {
        return leftOperand != null;
    }
}
