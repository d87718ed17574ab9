package com.di.sheetload.load;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Live column set of the destination table as reported by JDBC metadata. Lookups are
 * case-insensitive; SQL is generated with the names exactly as the backend stores them.
 */
public final class TableColumns {

    private static final Set<Integer> CHARACTER_TYPES = Set.of(Types.CHAR, Types.VARCHAR, Types.LONGVARCHAR,
            Types.NCHAR, Types.NVARCHAR, Types.LONGNVARCHAR, Types.CLOB, Types.NCLOB);

    public record Column(String name, int jdbcType) {
        public boolean isCharacter() {
            return CHARACTER_TYPES.contains(jdbcType);
        }
    }

    private final String schema;
    private final String table;
    private final String quote;
    private final Map<String, Column> columns;

    private TableColumns(String schema, String table, String quote, Map<String, Column> columns) {
        this.schema = schema;
        this.table = table;
        this.quote = quote;
        this.columns = Collections.unmodifiableMap(columns);
    }

    /**
     * Reads the columns of {@code qualifiedName} ("table" or "schema.table"). The name is tried as
     * given, then upper-cased, then lower-cased, since backends fold unquoted identifiers differently.
     *
     * @return the columns, or an empty result when the table does not exist
     */
    public static TableColumns read(DatabaseMetaData metaData, String catalog, String qualifiedName) throws SQLException {
        String[] parts = qualifiedName.split("\\.", 2);
        String schemaName = parts.length == 2 ? parts[0] : null;
        String tableName = parts.length == 2 ? parts[1] : parts[0];
        String quote = metaData.getIdentifierQuoteString();
        quote = quote == null || quote.isBlank() ? "" : quote.trim();

        for (String candidate : List.of(tableName, tableName.toUpperCase(Locale.ROOT), tableName.toLowerCase(Locale.ROOT))) {
            String schemaCandidate = schemaName == null ? null : foldLike(schemaName, candidate, tableName);
            Map<String, Column> found = new LinkedHashMap<>();
            String actualTable = null;
            String actualSchema = null;
            try (ResultSet rs = metaData.getColumns(catalog, schemaCandidate, candidate, "%")) {
                while (rs.next()) {
                    String table = rs.getString("TABLE_NAME");
                    String tableSchema = rs.getString("TABLE_SCHEM");
                    if (!table.equalsIgnoreCase(tableName)) {
                        continue;
                    }
                    if (actualTable == null) {
                        actualTable = table;
                        actualSchema = tableSchema;
                    } else if (!table.equals(actualTable) || !sameSchema(tableSchema, actualSchema)) {
                        continue;
                    }
                    String column = rs.getString("COLUMN_NAME");
                    found.putIfAbsent(column.toLowerCase(Locale.ROOT), new Column(column, rs.getInt("DATA_TYPE")));
                }
            }
            if (!found.isEmpty()) {
                return new TableColumns(schemaName == null ? null : actualSchema, actualTable, quote, found);
            }
        }
        return new TableColumns(schemaName, tableName, quote, new LinkedHashMap<>());
    }

    private static String foldLike(String schemaName, String candidate, String original) {
        if (candidate.equals(original)) {
            return schemaName;
        }
        return candidate.equals(original.toUpperCase(Locale.ROOT))
                ? schemaName.toUpperCase(Locale.ROOT) : schemaName.toLowerCase(Locale.ROOT);
    }

    private static boolean sameSchema(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    public boolean exists() {
        return !columns.isEmpty();
    }

    public Optional<Column> find(String name) {
        return Optional.ofNullable(columns.get(name.toLowerCase(Locale.ROOT)));
    }

    public boolean contains(String name) {
        return columns.containsKey(name.toLowerCase(Locale.ROOT));
    }

    /** Quoted column identifier as stored by the backend. */
    public String quotedColumn(String name) {
        return quote(find(name).map(Column::name).orElse(name));
    }

    /** Quoted, schema-qualified table identifier as stored by the backend. */
    public String quotedTable() {
        return schema == null ? quote(table) : quote(schema) + "." + quote(table);
    }

    public int size() {
        return columns.size();
    }

    private String quote(String identifier) {
        return quote + identifier + quote;
    }
}
