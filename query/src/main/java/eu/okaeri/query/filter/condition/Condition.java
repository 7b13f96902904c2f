package eu.okaeri.query.filter.condition;

import eu.okaeri.query.FieldPath;
import eu.okaeri.query.QueryValidationException;
import eu.okaeri.query.filter.Filter;
import eu.okaeri.query.filter.predicate.Predicate;
import eu.okaeri.query.filter.predicate.collection.ArrayContainsAnyPredicate;
import eu.okaeri.query.filter.predicate.collection.ArrayContainsPredicate;
import eu.okaeri.query.filter.predicate.collection.InPredicate;
import eu.okaeri.query.filter.predicate.collection.NotInPredicate;
import eu.okaeri.query.filter.predicate.equality.EqPredicate;
import eu.okaeri.query.filter.predicate.equality.NePredicate;
import eu.okaeri.query.filter.predicate.nullity.IsNullPredicate;
import eu.okaeri.query.filter.predicate.nullity.NotNullPredicate;
import eu.okaeri.query.filter.predicate.numeric.GtPredicate;
import eu.okaeri.query.filter.predicate.numeric.GtePredicate;
import eu.okaeri.query.filter.predicate.numeric.LtPredicate;
import eu.okaeri.query.filter.predicate.numeric.LtePredicate;
import eu.okaeri.query.filter.predicate.string.ContainsPredicate;
import eu.okaeri.query.filter.predicate.string.EndsWithPredicate;
import eu.okaeri.query.filter.predicate.string.MatchesPredicate;
import eu.okaeri.query.filter.predicate.string.StartsWithPredicate;
import eu.okaeri.query.value.Value;
import eu.okaeri.query.value.ValueType;
import eu.okaeri.query.value.ValueUtils;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import static eu.okaeri.query.filter.predicate.PredicateValidation.validatedAll;

/**
 * Leaf filter: field, operator and operands.
 * <p>
 * The operand count always matches {@link Operator#getArity()}. Operands given
 * to {@link Operator#IS_NULL} and {@link Operator#IS_NOT_NULL} are dropped.
 */
@Getter
@ToString(exclude = "predicate")
@EqualsAndHashCode(exclude = "predicate")
public class Condition implements Filter {

    private final FieldPath field;
    private final Operator operator;
    private final List<Value> operands;
    private final boolean caseSensitive;

    @Getter(lombok.AccessLevel.NONE)
    private final transient Predicate predicate;

    public Condition(@NonNull FieldPath field, @NonNull Operator operator, @NonNull List<Value> operands, boolean caseSensitive) {
        this.field = field;
        this.operator = operator;
        this.operands = validate(operator, operands, caseSensitive);
        this.caseSensitive = caseSensitive;
        this.predicate = this.hasFieldReferences() ? null : this.createPredicate(ValueUtils::toNative);
    }

    private static List<Value> validate(Operator operator, List<Value> operands, boolean caseSensitive) {

        if (!caseSensitive && !operator.isCaseAware()) {
            throw new QueryValidationException("case-insensitive matching is not supported by " + operator);
        }

        for (Value operand : operands) {
            if (operand == null) {
                throw new QueryValidationException(operator + " operands cannot contain null, use Value.nullValue()");
            }
        }

        switch (operator.getArity()) {
            case NONE:
                return Collections.emptyList();
            case SINGLE:
                if (operands.size() != 1) {
                    throw new QueryValidationException(operator + " requires exactly one operand, got " + operands.size());
                }
                validateSingle(operator, operands.get(0));
                break;
            case LIST:
                break;
            default:
                throw new IllegalArgumentException("Unsupported arity: " + operator.getArity());
        }

        return Collections.unmodifiableList(validatedAll(new ArrayList<>(operands)));
    }

    private static void validateSingle(Operator operator, Value operand) {
        if (operand.isFieldRef()) {
            return;
        }
        if (operator.isTextual() && (operand.getType() != ValueType.STRING)) {
            throw new QueryValidationException(operator + " requires a string operand, got " + operand);
        }
        if (operator.isOrdering() && operand.isNull()) {
            throw new QueryValidationException(operator + " cannot compare against null");
        }
        if (operator == Operator.MATCHES) {
            MatchesPredicate.compile(operand.asString(), true);
        }
    }

    public static Condition of(@NonNull String field, @NonNull Operator operator, @NonNull List<Value> operands, boolean caseSensitive) {
        return new Condition(FieldPath.of(field), operator, operands, caseSensitive);
    }

    public static Condition of(@NonNull String field, @NonNull Operator operator, Object operand) {
        if (operator.getArity() == OperandArity.NONE) {
            return of(field, operator, Collections.emptyList(), true);
        }
        if ((operator.getArity() == OperandArity.LIST) && (operand instanceof Collection)) {
            return of(field, operator, toValues((Collection<?>) operand), true);
        }
        return of(field, operator, Collections.singletonList(Value.of(operand)), true);
    }

    public static Condition eq(@NonNull String field, Object value) {
        return of(field, Operator.EQ, value);
    }

    public static Condition eqIgnoreCase(@NonNull String field, @NonNull String value) {
        return of(field, Operator.EQ, Collections.singletonList(Value.string(value)), false);
    }

    public static Condition ne(@NonNull String field, Object value) {
        return of(field, Operator.NE, value);
    }

    public static Condition lt(@NonNull String field, Object value) {
        return of(field, Operator.LT, value);
    }

    public static Condition lte(@NonNull String field, Object value) {
        return of(field, Operator.LTE, value);
    }

    public static Condition gt(@NonNull String field, Object value) {
        return of(field, Operator.GT, value);
    }

    public static Condition gte(@NonNull String field, Object value) {
        return of(field, Operator.GTE, value);
    }

    public static Condition contains(@NonNull String field, @NonNull String substring) {
        return contains(field, substring, true);
    }

    public static Condition contains(@NonNull String field, @NonNull String substring, boolean caseSensitive) {
        return of(field, Operator.CONTAINS, Collections.singletonList(Value.string(substring)), caseSensitive);
    }

    public static Condition startsWith(@NonNull String field, @NonNull String prefix) {
        return startsWith(field, prefix, true);
    }

    public static Condition startsWith(@NonNull String field, @NonNull String prefix, boolean caseSensitive) {
        return of(field, Operator.STARTS_WITH, Collections.singletonList(Value.string(prefix)), caseSensitive);
    }

    public static Condition endsWith(@NonNull String field, @NonNull String suffix) {
        return endsWith(field, suffix, true);
    }

    public static Condition endsWith(@NonNull String field, @NonNull String suffix, boolean caseSensitive) {
        return of(field, Operator.ENDS_WITH, Collections.singletonList(Value.string(suffix)), caseSensitive);
    }

    public static Condition matches(@NonNull String field, @NonNull String regex) {
        return of(field, Operator.MATCHES, regex);
    }

    public static Condition matches(@NonNull String field, @NonNull String regex, boolean caseSensitive) {
        return of(field, Operator.MATCHES, Collections.singletonList(Value.string(regex)), caseSensitive);
    }

    public static Condition arrayContains(@NonNull String field, Object element) {
        return of(field, Operator.ARRAY_CONTAINS, element);
    }

    public static Condition arrayContainsAny(@NonNull String field, @NonNull Collection<?> elements) {
        return of(field, Operator.ARRAY_CONTAINS_ANY, toValues(elements), true);
    }

    public static Condition in(@NonNull String field, @NonNull Collection<?> values) {
        return of(field, Operator.IN, toValues(values), true);
    }

    public static Condition in(@NonNull String field, @NonNull Object... values) {
        return in(field, Arrays.asList(values));
    }

    public static Condition notIn(@NonNull String field, @NonNull Collection<?> values) {
        return of(field, Operator.NOT_IN, toValues(values), true);
    }

    public static Condition notIn(@NonNull String field, @NonNull Object... values) {
        return notIn(field, Arrays.asList(values));
    }

    public static Condition isNull(@NonNull String field) {
        return of(field, Operator.IS_NULL, Collections.emptyList(), true);
    }

    public static Condition isNotNull(@NonNull String field) {
        return of(field, Operator.IS_NOT_NULL, Collections.emptyList(), true);
    }

    /**
     * Equality between a field and another field (e.g. a join key),
     * {@code field == $reference}.
     */
    public static Condition fieldEq(@NonNull String field, @NonNull String referencedField) {
        return of(field, Operator.EQ, Collections.singletonList(Value.field(referencedField)), true);
    }

    private static List<Value> toValues(Collection<?> values) {
        List<Value> converted = new ArrayList<>(values.size());
        for (Object value : values) {
            converted.add(Value.of(value));
        }
        return converted;
    }

    /**
     * @return the single operand, or null for operators without exactly one
     */
    public Value getOperand() {
        return (this.operator.getArity() == OperandArity.SINGLE) ? this.operands.get(0) : null;
    }

    public boolean hasFieldReferences() {
        return this.operands.stream().anyMatch(Value::isFieldRef);
    }

    /**
     * Predicate for literal operands, created once per condition.
     *
     * @throws IllegalStateException if operands reference other fields
     */
    public Predicate predicate() {
        if (this.predicate == null) {
            throw new IllegalStateException("condition on " + this.field + " references other fields, use predicate(resolver)");
        }
        return this.predicate;
    }

    /**
     * Predicate with field references resolved by the given function
     * (usually a lookup into the evaluated row).
     */
    public Predicate predicate(@NonNull Function<Value, Object> resolver) {
        if (this.predicate != null) {
            return this.predicate;
        }
        return this.createPredicate(value -> value.isFieldRef() ? resolver.apply(value) : ValueUtils.toNative(value));
    }

    private Predicate createPredicate(Function<Value, Object> resolver) {

        List<Object> resolved = new ArrayList<>(this.operands.size());
        for (Value operand : this.operands) {
            resolved.add(resolver.apply(operand));
        }
        Object single = resolved.isEmpty() ? null : resolved.get(0);

        switch (this.operator) {
            case EQ:
                return new EqPredicate(single, this.caseSensitive);
            case NE:
                return new NePredicate(single, this.caseSensitive);
            case LT:
                return nullSafe(single, LtPredicate::new);
            case LTE:
                return nullSafe(single, LtePredicate::new);
            case GT:
                return nullSafe(single, GtPredicate::new);
            case GTE:
                return nullSafe(single, GtePredicate::new);
            case CONTAINS:
                return textual(single, text -> new ContainsPredicate(text, this.caseSensitive));
            case STARTS_WITH:
                return textual(single, text -> new StartsWithPredicate(text, this.caseSensitive));
            case ENDS_WITH:
                return textual(single, text -> new EndsWithPredicate(text, this.caseSensitive));
            case MATCHES:
                return textual(single, text -> new MatchesPredicate(text, this.caseSensitive));
            case ARRAY_CONTAINS:
                return new ArrayContainsPredicate(single);
            case ARRAY_CONTAINS_ANY:
                return new ArrayContainsAnyPredicate(resolved);
            case IN:
                return new InPredicate(resolved);
            case NOT_IN:
                return new NotInPredicate(resolved);
            case IS_NULL:
                return new IsNullPredicate();
            case IS_NOT_NULL:
                return new NotNullPredicate();
            default:
                throw new IllegalArgumentException("Unsupported operator: " + this.operator);
        }
    }

    // a reference resolving to null or to a non-string cannot match
    private static Predicate nullSafe(Object operand, Function<Object, Predicate> factory) {
        return (operand == null) ? leftOperand -> false : factory.apply(operand);
    }

    private static Predicate textual(Object operand, Function<String, Predicate> factory) {
        return (operand instanceof CharSequence) ? factory.apply(operand.toString()) : leftOperand -> false;
    }
}
