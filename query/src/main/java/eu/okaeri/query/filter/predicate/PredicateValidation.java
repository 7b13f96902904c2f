package eu.okaeri.query.filter.predicate;

import eu.okaeri.query.QueryValidationException;
import eu.okaeri.query.value.Value;
import eu.okaeri.query.value.ValueType;

import java.util.Collection;

/**
 * Utility class for operand validation.
 */
public final class PredicateValidation {

    private PredicateValidation() {
    }

    /**
     * Validates that an operand does not contain null bytes if it's a string.
     * Null bytes are not supported by most storage engines.
     *
     * @param operand the operand to validate
     * @return the operand if valid
     * @throws QueryValidationException if the operand is a string containing null bytes
     */
    public static Value validated(Value operand) {
        if ((operand.getType() == ValueType.STRING) && (operand.asString().indexOf('\0') != -1)) {
            throw new QueryValidationException("Null bytes are not supported in string values");
        }
        return operand;
    }

    /**
     * Validates that a collection does not contain strings with null bytes.
     *
     * @param values the collection to validate
     * @return the collection if valid
     * @throws QueryValidationException if any element is a string containing null bytes
     */
    public static <T extends Collection<Value>> T validatedAll(T values) {
        for (Value value : values) {
            validated(value);
        }
        return values;
    }
}
