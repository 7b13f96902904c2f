package eu.okaeri.query.evaluate;

import eu.okaeri.query.value.ValueUtils;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named collections of rows read by the {@link InMemoryQueryExecutor}.
 * Rows are copied on registration and on every read.
 */
public class InMemoryDataset {

    private final Map<String, List<Map<String, Object>>> entities = new ConcurrentHashMap<>();

    public InMemoryDataset register(@NonNull String entity, @NonNull List<Map<String, Object>> rows) {
        this.entities.put(entity, copy(rows));
        return this;
    }

    public boolean contains(@NonNull String entity) {
        return this.entities.containsKey(entity);
    }

    public Set<String> getEntities() {
        return Collections.unmodifiableSet(this.entities.keySet());
    }

    /**
     * @throws EntityNotFoundException if nothing was registered under the name
     */
    public List<Map<String, Object>> rows(@NonNull String entity) {
        List<Map<String, Object>> rows = this.entities.get(entity);
        if (rows == null) {
            throw new EntityNotFoundException(entity);
        }
        return copy(rows);
    }

    public int size(@NonNull String entity) {
        List<Map<String, Object>> rows = this.entities.get(entity);
        if (rows == null) {
            throw new EntityNotFoundException(entity);
        }
        return rows.size();
    }

    private static List<Map<String, Object>> copy(List<Map<String, Object>> rows) {
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(ValueUtils.deepCopy(row));
        }
        return copy;
    }
}
