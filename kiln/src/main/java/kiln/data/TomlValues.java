// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.data;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Conversion of tomlj's parse trees into {@link DataValue}s.
 */
public final class TomlValues {
    private TomlValues() {
    }

    /**
     * Converts a parsed TOML table.
     */
    public static DataValue.Table toTable(final TomlTable table) {
        final var entries = new LinkedHashMap<String, DataValue>();
        for (final var entry : table.entrySet()) {
            entries.put(entry.getKey(), toValue(entry.getValue()));
        }
        return new DataValue.Table(entries);
    }

    /**
     * Joins tomlj's parse errors into a single human-readable string, one error per line.
     */
    public static String describeErrors(final TomlParseResult result) {
        final var builder = new StringBuilder();
        for (final var error : result.errors()) {
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append(error.toString());
        }
        return builder.toString();
    }

    private static DataValue toValue(final Object value) {
        if (value instanceof final TomlTable table) {
            return toTable(table);
        }
        if (value instanceof final TomlArray array) {
            final var elements = new ArrayList<DataValue>(array.size());
            for (int i = 0; i < array.size(); i += 1) {
                elements.add(toValue(array.get(i)));
            }
            return new DataValue.Array(elements);
        }
        if (value instanceof final String string) {
            return new DataValue.Text(string);
        }
        if (value instanceof final Long number) {
            return new DataValue.Integral(number);
        }
        if (value instanceof final Double number) {
            return new DataValue.Decimal(number);
        }
        if (value instanceof final Boolean bool) {
            return new DataValue.Bool(bool);
        }
        if (value instanceof final TemporalAccessor temporal) {
            return new DataValue.DateTime(temporal);
        }
        throw new AssertionError("tomlj produced a value of unexpected type " + value.getClass().getName());
    }
}
