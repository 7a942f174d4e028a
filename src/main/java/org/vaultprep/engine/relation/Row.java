package org.vaultprep.engine.relation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A row of values in a compiled relation.
 *
 * Null values are kept as null and serialize as empty fields.
 */
public record Row(List<String> values) {

    public Row {
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Row of(String... values) {
        List<String> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return new Row(list);
    }

    /**
     * Gets the value at the specified index.
     */
    public String get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }
}
