package eu.okaeri.query.relation;

import eu.okaeri.query.FieldPath;
import eu.okaeri.query.QueryValidationException;
import eu.okaeri.query.filter.Filter;
import eu.okaeri.query.filter.condition.Condition;
import lombok.Data;
import lombok.NonNull;

/**
 * Secondary entity attached to the primary rows under {@link #getAlias()}.
 * <p>
 * The {@link #getOn()} filter is evaluated against the primary row with the
 * candidate related row nested under the alias, so the related side is
 * addressed as {@code alias.field} through {@code Value.field(...)} operands.
 * {@link #isEager()} asks for inline materialization and is only a hint.
 */
@Data
public class Relation {

    private final String entity;
    private final String alias;
    private final JoinType type;
    private final Filter on;
    private final boolean eager;

    public Relation(@NonNull String entity, @NonNull String alias, @NonNull JoinType type, @NonNull Filter on, boolean eager) {
        if (entity.trim().isEmpty()) {
            throw new QueryValidationException("relation entity cannot be empty");
        }
        if (alias.trim().isEmpty()) {
            throw new QueryValidationException("relation alias cannot be empty");
        }
        if (alias.contains(FieldPath.SEPARATOR)) {
            throw new QueryValidationException("relation alias '" + alias + "' cannot contain '" + FieldPath.SEPARATOR + "'");
        }
        this.entity = entity;
        this.alias = alias;
        this.type = type;
        this.on = on;
        this.eager = eager;
    }

    /**
     * Inner join on {@code localField == alias.foreignField}.
     */
    public static Relation inner(@NonNull String entity, @NonNull String alias, @NonNull String localField, @NonNull String foreignField) {
        return new Relation(entity, alias, JoinType.INNER, Condition.fieldEq(localField, alias + FieldPath.SEPARATOR + foreignField), true);
    }

    /**
     * Left outer join on {@code localField == alias.foreignField}.
     */
    public static Relation leftOuter(@NonNull String entity, @NonNull String alias, @NonNull String localField, @NonNull String foreignField) {
        return new Relation(entity, alias, JoinType.LEFT_OUTER, Condition.fieldEq(localField, alias + FieldPath.SEPARATOR + foreignField), true);
    }

    public Relation lazy() {
        return new Relation(this.entity, this.alias, this.type, this.on, false);
    }
}
