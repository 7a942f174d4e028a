package org.vaultprep.engine.serialization;

import org.vaultprep.engine.relation.Relation;
import org.vaultprep.engine.relation.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * CSV serializer for compiled relations.
 *
 * Header row first, fields comma-joined, rows joined with a bare newline and
 * no trailing line break. Values containing commas, quotes, or line breaks
 * are wrapped in quotes with inner quotes doubled. Null values become empty
 * fields.
 */
public final class CsvSerializer implements RelationSerializer {

    public static final CsvSerializer INSTANCE = new CsvSerializer();

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';
    private static final String LINE_ENDING = "\n";

    private CsvSerializer() {
    }

    @Override
    public String formatId() {
        return "csv";
    }

    @Override
    public String serialize(Relation relation) {
        List<List<String>> lines = new ArrayList<>(relation.rows().size() + 1);
        lines.add(relation.header());
        for (Row row : relation.rows()) {
            lines.add(row.values());
        }
        return toCsv(lines);
    }

    /**
     * Serializes any rectangular set of rows; the first row is the header.
     */
    public String toCsv(List<List<String>> rows) {
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < rows.size(); r++) {
            if (r > 0) {
                sb.append(LINE_ENDING);
            }
            List<String> values = rows.get(r);
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) {
                    sb.append(DELIMITER);
                }
                sb.append(escapeField(values.get(i)));
            }
        }
        return sb.toString();
    }

    public String escapeField(String value) {
        if (value == null) {
            return "";
        }

        boolean needsQuoting = value.indexOf(DELIMITER) >= 0
                || value.indexOf(QUOTE) >= 0
                || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0;

        if (!needsQuoting) {
            return value;
        }

        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append(QUOTE);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == QUOTE) {
                sb.append(QUOTE);
            }
            sb.append(c);
        }
        sb.append(QUOTE);
        return sb.toString();
    }
}
