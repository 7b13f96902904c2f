package eu.okaeri.query.filter.predicate.string;

import lombok.NonNull;

/**
 * String prefix predicate.
 * {@code field startsWith "prefix"}
 */
public class StartsWithPredicate extends StringPredicate {

    public StartsWithPredicate(@NonNull String prefix, boolean caseSensitive) {
        super(prefix, caseSensitive);
    }

    @Override
    protected boolean test(String left, String right) {
        return left.startsWith(right);
    }
}
