package eu.okaeri.query.filter.predicate.equality;

import eu.okaeri.query.filter.predicate.SimplePredicate;
import lombok.Getter;

import static eu.okaeri.query.value.ValueUtils.compareEquals;

/**
 * VALUE equals X
 * {@code val == x}
 */
public class EqPredicate extends SimplePredicate {

    @Getter
    private final boolean caseSensitive;

    public EqPredicate(Object rightOperand, boolean caseSensitive) {
        super(rightOperand);
        this.caseSensitive = caseSensitive;
    }

    @Override
    public boolean check(Object leftOperand) {
        if (!this.caseSensitive && (leftOperand instanceof CharSequence) && (this.getRightOperand() instanceof CharSequence)) {
            return leftOperand.toString().equalsIgnoreCase(this.getRightOperand().toString());
        }
        return compareEquals(leftOperand, this.getRightOperand());
    }
}
