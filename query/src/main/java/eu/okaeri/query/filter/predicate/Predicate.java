package eu.okaeri.query.filter.predicate;

/**
 * Pure test of a single row value against resolved operands.
 */
public interface Predicate {

    /**
     * @param leftOperand value of the condition field, null when absent
     * @return true if the value satisfies the predicate
     */
    boolean check(Object leftOperand);
}
