package eu.okaeri.query.evaluate;

import eu.okaeri.query.FieldPath;
import eu.okaeri.query.QueryValidationException;
import eu.okaeri.query.search.Search;
import eu.okaeri.query.search.SearchType;
import eu.okaeri.query.value.ValueUtils;
import lombok.NonNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static eu.okaeri.query.value.ValueUtils.extractValue;

/**
 * Scores rows for {@link Search} requests, all scores are within [0, 1].
 * <ul>
 *   <li>text: share of query tokens found in each field, weighted by field boost
 *   and divided by the sum of boosts</li>
 *   <li>vector: cosine similarity of the embedding and the row vector,
 *   negative similarity scores 0</li>
 *   <li>hybrid: {@code alpha * text + (1 - alpha) * vector}</li>
 * </ul>
 */
public class InMemorySearchScorer {

    public static final double DEFAULT_HYBRID_ALPHA = 0.5;
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final double hybridAlpha;

    public InMemorySearchScorer() {
        this(DEFAULT_HYBRID_ALPHA);
    }

    public InMemorySearchScorer(double hybridAlpha) {
        if (!(hybridAlpha >= 0) || (hybridAlpha > 1)) {
            throw new IllegalArgumentException("hybrid alpha must be within [0, 1], got " + hybridAlpha);
        }
        this.hybridAlpha = hybridAlpha;
    }

    /**
     * Final score used against {@link Search#getMinScore()}.
     */
    public double score(@NonNull Search search, @NonNull Map<String, Object> row) {
        SearchType type = search.getType();
        if (type == SearchType.FULL_TEXT) {
            return this.textScore(search, row);
        }
        if (type == SearchType.SEMANTIC) {
            return this.vectorScore(search, row);
        }
        if (type == SearchType.HYBRID) {
            return (this.hybridAlpha * this.textScore(search, row)) + ((1 - this.hybridAlpha) * this.vectorScore(search, row));
        }
        throw new IllegalArgumentException("Unsupported search type: " + type);
    }

    /**
     * A row is a hit when its score reaches {@link Search#getMinScore()}.
     * Text and hybrid searches additionally drop rows scoring exactly 0,
     * semantic searches keep them.
     */
    public boolean passes(@NonNull Search search, double score) {
        if ((search.getType() != SearchType.SEMANTIC) && (score <= 0)) {
            return false;
        }
        return score >= search.getMinScore();
    }

    public double textScore(@NonNull Search search, @NonNull Map<String, Object> row) {

        Set<String> queryTokens = tokenize(search.getQuery());
        if (queryTokens.isEmpty() || search.getFields().isEmpty()) {
            return 0;
        }

        double weighted = 0;
        double totalWeight = 0;

        for (String field : search.getFields()) {
            double boost = search.boostOf(field);
            totalWeight += boost;

            Set<String> fieldTokens = tokenize(text(extractValue(row, FieldPath.of(field).toParts())));
            if (fieldTokens.isEmpty()) {
                continue;
            }

            long matched = queryTokens.stream().filter(fieldTokens::contains).count();
            weighted += boost * ((double) matched / queryTokens.size());
        }

        return (totalWeight == 0) ? 0 : (weighted / totalWeight);
    }

    /**
     * @throws QueryValidationException if the row vector has a different dimensionality
     */
    public double vectorScore(@NonNull Search search, @NonNull Map<String, Object> row) {

        List<Object> vector = ValueUtils.asList(extractValue(row, FieldPath.of(search.getVectorField()).toParts()));
        if ((vector == null) || vector.isEmpty()) {
            return 0;
        }

        List<Float> embedding = search.getEmbedding();
        if (vector.size() != embedding.size()) {
            throw new QueryValidationException("embedding has " + embedding.size() + " dimensions, "
                + search.getVectorField() + " has " + vector.size());
        }

        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < embedding.size(); i++) {
            Object component = vector.get(i);
            if (!ValueUtils.isNumeric(component)) {
                return 0;
            }
            double a = embedding.get(i);
            double b = ((Number) component).doubleValue();
            dot += a * b;
            normA += a * a;
            normB += b * b;
        }

        if ((normA == 0) || (normB == 0)) {
            return 0;
        }

        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(0, Math.min(1, cosine));
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        List<Object> elements = ValueUtils.asList(value);
        if (elements != null) {
            return elements.stream().map(String::valueOf).collect(Collectors.joining(" "));
        }
        return String.valueOf(value);
    }

    static Set<String> tokenize(String text) {
        if ((text == null) || text.trim().isEmpty()) {
            return Collections.emptySet();
        }
        return Arrays.stream(TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT)))
            .filter(token -> !token.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
