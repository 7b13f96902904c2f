package eu.okaeri.query.filter.predicate.string;

import lombok.NonNull;

/**
 * String contains predicate.
 * {@code field contains "substring"}
 */
public class ContainsPredicate extends StringPredicate {

    public ContainsPredicate(@NonNull String substring, boolean caseSensitive) {
        super(substring, caseSensitive);
    }

    @Override
    protected boolean test(String left, String right) {
        return left.contains(right);
    }
}
