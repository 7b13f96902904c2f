package eu.okaeri.query.filter.predicate.string;

import lombok.NonNull;

/**
 * String suffix predicate.
 * {@code field endsWith "suffix"}
 */
public class EndsWithPredicate extends StringPredicate {

    public EndsWithPredicate(@NonNull String suffix, boolean caseSensitive) {
        super(suffix, caseSensitive);
    }

    @Override
    protected boolean test(String left, String right) {
        return left.endsWith(right);
    }
}
