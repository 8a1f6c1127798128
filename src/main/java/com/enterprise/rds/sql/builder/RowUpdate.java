package com.enterprise.rds.sql.builder;

import com.enterprise.rds.sql.SqlConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a batched update: the values to set and the condition selecting the row.
 *
 * <pre>{@code
 * RowUpdate.byId(Map.of("id", 1, "name", "fengmk21"));
 * new RowUpdate(Map.of("name", "fengmk21"), Map.of("email", "m@fengmk2.com"));
 * }</pre>
 */
public record RowUpdate(Map<String, Object> row, Map<String, Object> where) {

    public static final String ID = "id";

    public RowUpdate {
        if (row == null) {
            throw new SqlConfigurationException("updateRows entry has no row");
        }
        if (where == null || where.isEmpty()) {
            throw new SqlConfigurationException("updateRows entry has no where condition");
        }
        row = Collections.unmodifiableMap(new LinkedHashMap<>(row));
        where = Collections.unmodifiableMap(new LinkedHashMap<>(where));
    }

    /**
     * {@code {id: 1, name: 'a'}} becomes row {@code {name: 'a'}} with where {@code {id: 1}}.
     */
    public static RowUpdate byId(Map<String, ?> values) {
        if (values == null || !values.containsKey(ID)) {
            throw new SqlConfigurationException("updateRows entry has no id: " + values);
        }
        Map<String, Object> row = new LinkedHashMap<>(values);
        Object id = row.remove(ID);
        Map<String, Object> where = new LinkedHashMap<>();
        where.put(ID, id);
        return new RowUpdate(row, where);
    }

    /**
     * Accepts either the {@code {id, ...columns}} shape or the explicit
     * {@code {row: {...}, where: {...}}} shape. An {@code id} key wins over
     * {@code row}/{@code where}.
     *
     * @throws SqlConfigurationException if neither shape fits
     */
    @SuppressWarnings("unchecked")
    public static RowUpdate from(Map<String, ?> option) {
        if (option == null) {
            throw new SqlConfigurationException("updateRows entry must not be null");
        }
        if (option.containsKey(ID)) {
            return byId(option);
        }
        Object row = option.get("row");
        Object where = option.get("where");
        if (row instanceof Map<?, ?> && where instanceof Map<?, ?> w && !w.isEmpty()) {
            return new RowUpdate((Map<String, Object>) row, (Map<String, Object>) where);
        }
        throw new SqlConfigurationException(
                "Can not auto detect updateRows condition, please set row and where, "
                        + "or make sure id exists: " + option);
    }
}
