package eu.okaeri.query.search;

import eu.okaeri.query.QueryValidationException;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;
import lombok.Singular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Text and/or vector similarity scoring, conjunctive with the query filter.
 * <ul>
 *   <li>FULL_TEXT scores {@link #getQuery()} against {@link #getFields()}, weighted by {@link #getBoost()} (1.0 when unlisted)</li>
 *   <li>SEMANTIC scores {@link #getEmbedding()} against {@link #getVectorField()}</li>
 *   <li>HYBRID combines both, {@link #getMinScore()} applies to the combined score</li>
 * </ul>
 * Embedding dimensionality is checked by the executor, not here.
 */
@Data
public class Search {

    public static final double DEFAULT_BOOST = 1.0;

    private final String query;
    private final SearchType type;
    private final List<String> fields;
    private final String vectorField;
    private final List<Float> embedding;
    private final double minScore;
    private final Map<String, Double> boost;

    @Builder
    public Search(String query, @NonNull SearchType type, @Singular List<String> fields, String vectorField,
                  List<Float> embedding, double minScore, @Singular("boost") Map<String, Double> boosts) {

        boolean hasText = (query != null) && !query.trim().isEmpty();
        boolean hasVector = (vectorField != null) && !vectorField.trim().isEmpty() && (embedding != null) && !embedding.isEmpty();

        if (type.usesText() && !hasText) {
            throw new QueryValidationException(type + " search requires a query text");
        }
        if (type.usesVector() && !hasVector) {
            throw new QueryValidationException(type + " search requires a vector field and an embedding");
        }
        if ((type == SearchType.HYBRID) && fields.isEmpty()) {
            throw new QueryValidationException("HYBRID search requires full-text fields");
        }
        if (Double.isNaN(minScore) || (minScore < 0)) {
            throw new QueryValidationException("min score cannot be negative, got " + minScore);
        }
        for (Map.Entry<String, Double> entry : boosts.entrySet()) {
            if ((entry.getValue() == null) || !(entry.getValue() > 0)) {
                throw new QueryValidationException("boost for '" + entry.getKey() + "' must be positive, got " + entry.getValue());
            }
        }
        if (embedding != null) {
            for (Float component : embedding) {
                if ((component == null) || component.isNaN()) {
                    throw new QueryValidationException("embedding cannot contain null or NaN components");
                }
            }
        }

        this.query = query;
        this.type = type;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.vectorField = vectorField;
        this.embedding = (embedding == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(embedding));
        this.minScore = minScore;
        this.boost = Collections.unmodifiableMap(new LinkedHashMap<>(boosts));
    }

    public static Search fullText(@NonNull String query, @NonNull List<String> fields) {
        return Search.builder().type(SearchType.FULL_TEXT).query(query).fields(fields).build();
    }

    public static Search semantic(@NonNull String vectorField, @NonNull List<Float> embedding) {
        return Search.builder().type(SearchType.SEMANTIC).vectorField(vectorField).embedding(embedding).build();
    }

    public static Search hybrid(@NonNull String query, @NonNull List<String> fields, @NonNull String vectorField, @NonNull List<Float> embedding) {
        return Search.builder().type(SearchType.HYBRID).query(query).fields(fields).vectorField(vectorField).embedding(embedding).build();
    }

    public double boostOf(@NonNull String field) {
        return this.boost.getOrDefault(field, DEFAULT_BOOST);
    }

    public int getDimensions() {
        return this.embedding.size();
    }
}
