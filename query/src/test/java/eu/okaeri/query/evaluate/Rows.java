package eu.okaeri.query.evaluate;

import java.util.LinkedHashMap;
import java.util.Map;

final class Rows {

    private Rows() {
    }

    // allows null values, unlike Map.of
    static Map<String, Object> row(Object... keyValues) {
        if ((keyValues.length % 2) != 0) {
            throw new IllegalArgumentException("expected key-value pairs");
        }
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
