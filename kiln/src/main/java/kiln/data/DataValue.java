// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.data;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A value of page data, as read from TOML fragments and front matter.
 * <p>
 * Values are immutable. Tables keep the insertion order of their keys.
 */
public sealed interface DataValue
    permits DataValue.Text, DataValue.Integral, DataValue.Decimal, DataValue.Bool, DataValue.DateTime,
    DataValue.Array, DataValue.Table {
    /**
     * Converts the value into plain Java objects the template engine understands: strings, numbers, booleans,
     * lists and maps.
     */
    Object toTemplateValue();

    /**
     * A short name of the value's type, for diagnostics.
     */
    String typeName();

    record Text(String value) implements DataValue {
        @Override
        public Object toTemplateValue() {
            return value;
        }

        @Override
        public String typeName() {
            return "string";
        }
    }

    record Integral(long value) implements DataValue {
        @Override
        public Object toTemplateValue() {
            return value;
        }

        @Override
        public String typeName() {
            return "integer";
        }
    }

    record Decimal(double value) implements DataValue {
        @Override
        public Object toTemplateValue() {
            return value;
        }

        @Override
        public String typeName() {
            return "float";
        }
    }

    record Bool(boolean value) implements DataValue {
        @Override
        public Object toTemplateValue() {
            return value;
        }

        @Override
        public String typeName() {
            return "boolean";
        }
    }

    /**
     * A TOML date, time or date-time; rendered in its ISO-8601 form.
     */
    record DateTime(TemporalAccessor value) implements DataValue {
        @Override
        public Object toTemplateValue() {
            return value.toString();
        }

        @Override
        public String typeName() {
            return "datetime";
        }
    }

    record Array(List<DataValue> elements) implements DataValue {
        public Array {
            elements = List.copyOf(elements);
        }

        @Override
        public Object toTemplateValue() {
            final var result = new ArrayList<Object>(elements.size());
            for (final var element : elements) {
                result.add(element.toTemplateValue());
            }
            return result;
        }

        @Override
        public String typeName() {
            return "array";
        }
    }

    record Table(Map<String, DataValue> entries) implements DataValue {
        public Table {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public static Table empty() {
            return emptyTable;
        }

        public @Nullable DataValue get(final String key) {
            return entries.get(key);
        }

        public boolean containsKey(final String key) {
            return entries.containsKey(key);
        }

        /**
         * Returns a table with the given key set to the given value, replacing any previous value.
         */
        public Table with(final String key, final DataValue value) {
            final var copy = new LinkedHashMap<>(entries);
            copy.put(key, value);
            return new Table(copy);
        }

        /**
         * Returns this table overlaid with {@code overlay}: every key of the overlay replaces the key of the same
         * name here, including nested tables, which are replaced as a whole rather than merged.
         */
        public Table merge(final Table overlay) {
            if (overlay.entries.isEmpty()) {
                return this;
            }
            if (entries.isEmpty()) {
                return overlay;
            }
            final var copy = new LinkedHashMap<>(entries);
            copy.putAll(overlay.entries);
            return new Table(copy);
        }

        @Override
        public Map<String, Object> toTemplateValue() {
            final var result = new LinkedHashMap<String, Object>();
            for (final var entry : entries.entrySet()) {
                result.put(entry.getKey(), entry.getValue().toTemplateValue());
            }
            return result;
        }

        @Override
        public String typeName() {
            return "table";
        }

        private static final Table emptyTable = new Table(Map.of());
    }
}
