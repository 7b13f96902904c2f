package eu.okaeri.query.evaluate;

import eu.okaeri.query.QueryValidationException;
import eu.okaeri.query.relation.JoinType;
import eu.okaeri.query.relation.Relation;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Nested loop join of primary rows with related rows.
 * <p>
 * The related row is placed under the relation alias and the ON filter is
 * evaluated on the combined row. Each match yields one output row; primary
 * rows without a match are dropped for INNER joins and kept with a null
 * alias for LEFT_OUTER joins. Related rows are always materialized inline.
 * A row already holding a field named like the alias is rejected.
 */
@RequiredArgsConstructor
public class InMemoryRelationResolver {

    private final @NonNull InMemoryFilterEvaluator filterEvaluator;

    public List<Map<String, Object>> join(@NonNull List<Map<String, Object>> rows, @NonNull Relation relation,
                                          @NonNull List<Map<String, Object>> related) {

        List<Map<String, Object>> output = new ArrayList<>(rows.size());

        for (Map<String, Object> row : rows) {

            if (row.containsKey(relation.getAlias())) {
                throw new QueryValidationException("relation alias '" + relation.getAlias()
                    + "' collides with a field of the joined rows");
            }

            boolean matched = false;
            for (Map<String, Object> candidate : related) {
                Map<String, Object> combined = new LinkedHashMap<>(row);
                combined.put(relation.getAlias(), candidate);
                if (this.filterEvaluator.matches(relation.getOn(), combined)) {
                    output.add(combined);
                    matched = true;
                }
            }

            if (!matched && (relation.getType() == JoinType.LEFT_OUTER)) {
                Map<String, Object> combined = new LinkedHashMap<>(row);
                combined.put(relation.getAlias(), null);
                output.add(combined);
            }
        }

        return output;
    }
}
