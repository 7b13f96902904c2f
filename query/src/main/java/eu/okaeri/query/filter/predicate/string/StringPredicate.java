package eu.okaeri.query.filter.predicate.string;

import eu.okaeri.query.filter.predicate.SimplePredicate;
import lombok.Getter;
import lombok.NonNull;

import java.util.Locale;

/**
 * Base for substring style predicates. Non-string values never match.
 */
public abstract class StringPredicate extends SimplePredicate {

    @Getter
    private final boolean caseSensitive;

    protected StringPredicate(@NonNull String rightOperand, boolean caseSensitive) {
        super(rightOperand);
        this.caseSensitive = caseSensitive;
    }

    @Override
    public boolean check(Object leftOperand) {
        if (!(leftOperand instanceof CharSequence)) {
            return false;
        }

        String left = leftOperand.toString();
        String right = (String) this.getRightOperand();

        if (!this.caseSensitive) {
            return this.test(left.toLowerCase(Locale.ROOT), right.toLowerCase(Locale.ROOT));
        }
        return this.test(left, right);
    }

    protected abstract boolean test(String left, String right);
}
