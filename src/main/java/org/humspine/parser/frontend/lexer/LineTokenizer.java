package org.humspine.parser.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * The tokenizer splits a raw Humdrum line into its fields.
 * <p>
 * Fields are separated by a single tab. Blank lines and global comments ({@code !!...}) are not split:
 * they always produce exactly one field holding the whole line, so tabs inside a global comment survive.
 * The CSV variant only differs in how a line is split; it is converted to the tab-separated form before
 * the rest of the pipeline sees it.
 */
public final class LineTokenizer {

    /** The field delimiter of the native format. */
    public static final char FIELD_SEPARATOR = '\t';

    private LineTokenizer() {}

    /**
     * Splits a tab-separated line into fields.
     * @param line The raw line.
     * @return The fields, never empty.
     */
    public static List<String> splitFields(String line) {
        List<String> fields = new ArrayList<>();
        if (line == null || line.isEmpty() || line.startsWith("!!")) {
            fields.add(line == null ? "" : line);
            return fields;
        }
        int start = 0;
        int tab;
        while ((tab = line.indexOf(FIELD_SEPARATOR, start)) >= 0) {
            fields.add(line.substring(start, tab));
            start = tab + 1;
        }
        fields.add(line.substring(start));
        return fields;
    }

    /**
     * Converts one CSV record into the tab-separated line form.
     * Fields may be enclosed in double quotes; inside quotes a doubled quote stands for one quote
     * character and the separator has no special meaning.
     *
     * @param csvLine The CSV record.
     * @param separator The field separator, usually {@code ","}.
     * @return The equivalent tab-separated line.
     */
    public static String fromCsv(String csvLine, String separator) {
        if (csvLine == null || csvLine.isEmpty()) {
            return "";
        }
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("CSV separator must not be empty");
        }
        if (csvLine.startsWith("!!")) {
            return csvLine;
        }
        List<String> fields = splitCsv(csvLine, separator);
        if (fields.size() == 1 && fields.get(0).startsWith("!!")) {
            // a quoted global comment
            return fields.get(0);
        }
        return String.join(String.valueOf(FIELD_SEPARATOR), fields);
    }

    private static List<String> splitCsv(String line, String separator) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i += 2;
                        continue;
                    }
                    inQuotes = false;
                } else {
                    current.append(c);
                }
                i++;
            } else if (c == '"' && current.length() == 0) {
                inQuotes = true;
                i++;
            } else if (line.startsWith(separator, i)) {
                fields.add(current.toString());
                current.setLength(0);
                i += separator.length();
            } else {
                current.append(c);
                i++;
            }
        }
        fields.add(current.toString());
        return fields;
    }
}
