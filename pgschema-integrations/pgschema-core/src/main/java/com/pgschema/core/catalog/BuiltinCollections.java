package com.pgschema.core.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled-in manifest of the metadata collections served for a PostgreSQL
 * store: result schema, catalog query and restriction columns of each one.
 *
 * <p>Restriction columns name the column as it is visible to the WHERE
 * clause of the template, which is not always the output alias
 * ({@code datname} filters {@code database_name}).
 */
public final class BuiltinCollections {

    public static final String META_DATA_COLLECTIONS   = "MetaDataCollections";
    public static final String RESTRICTIONS            = "Restrictions";
    public static final String DATA_SOURCE_INFORMATION = "DataSourceInformation";
    public static final String RESERVED_WORDS          = "ReservedWords";
    public static final String DATABASES               = "Databases";
    public static final String TABLES                  = "Tables";
    public static final String COLUMNS                 = "Columns";
    public static final String VIEWS                   = "Views";
    public static final String USERS                   = "Users";
    public static final String INDEXES                 = "Indexes";
    public static final String INDEX_COLUMNS           = "IndexColumns";

    private BuiltinCollections() {}

    /**
     * Every built-in collection except the two derived from the catalog itself
     * ({@value #META_DATA_COLLECTIONS} and {@value #RESTRICTIONS}), in listing order.
     */
    public static List<CollectionDescriptor> all() {
        List<CollectionDescriptor> all = new ArrayList<>();
        all.add(dataSourceInformation());
        all.add(reservedWords());
        all.add(databases());
        all.add(tables());
        all.add(columns());
        all.add(views());
        all.add(users());
        all.add(indexes());
        all.add(indexColumns());
        return all;
    }

    // ------------------------------------------------------------------
    // Static collections
    // ------------------------------------------------------------------

    static CollectionDescriptor reservedWords() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String word : ReservedWords.all()) {
            rows.add(Map.of(ReservedWords.COLUMN, word));
        }
        return CollectionDescriptor.builder(RESERVED_WORDS)
                .addTextColumn(ReservedWords.COLUMN)
                .staticRows(rows)
                .build();
    }

    static CollectionDescriptor dataSourceInformation() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("CompositeIdentifierSeparatorPattern", "\\.");
        row.put("DataSourceProductName",               "PostgreSQL");
        row.put("GroupByBehavior",                     2);   // unrelated
        row.put("IdentifierPattern",                   "^[\\p{L}_][\\p{L}\\p{Nd}_$]*$|^\"([^\"]|\"\")+\"$");
        row.put("IdentifierCase",                      1);   // insensitive
        row.put("OrderByColumnsInSelect",              false);
        row.put("ParameterMarkerFormat",               ":{0}");
        row.put("ParameterMarkerPattern",              ":([\\p{L}_][\\p{L}\\p{Nd}_]*)");
        row.put("ParameterNameMaxLength",              63);
        row.put("ParameterNamePattern",                "^[\\p{L}_][\\p{L}\\p{Nd}_]*$");
        row.put("QuotedIdentifierPattern",             "\"(([^\"]|\"\")*)\"");
        row.put("QuotedIdentifierCase",                2);   // sensitive
        row.put("StatementSeparatorPattern",           ";");
        row.put("StringLiteralPattern",                "'(([^']|'')*)'");
        row.put("SupportedJoinOperators",              15);  // inner, left, right, full

        return CollectionDescriptor.builder(DATA_SOURCE_INFORMATION)
                .addTextColumn("CompositeIdentifierSeparatorPattern")
                .addTextColumn("DataSourceProductName")
                .addIntColumn("GroupByBehavior")
                .addTextColumn("IdentifierPattern")
                .addIntColumn("IdentifierCase")
                .addBooleanColumn("OrderByColumnsInSelect")
                .addTextColumn("ParameterMarkerFormat")
                .addTextColumn("ParameterMarkerPattern")
                .addIntColumn("ParameterNameMaxLength")
                .addTextColumn("ParameterNamePattern")
                .addTextColumn("QuotedIdentifierPattern")
                .addIntColumn("QuotedIdentifierCase")
                .addTextColumn("StatementSeparatorPattern")
                .addTextColumn("StringLiteralPattern")
                .addIntColumn("SupportedJoinOperators")
                .staticRows(List.of(row))
                .build();
    }

    // ------------------------------------------------------------------
    // Query-backed collections
    // ------------------------------------------------------------------

    static CollectionDescriptor databases() {
        return CollectionDescriptor.builder(DATABASES)
                .addTextColumn("database_name")
                .addTextColumn("owner")
                .addTextColumn("encoding")
                .queryTemplate("SELECT d.datname AS database_name, u.usename AS owner, "
                        + "pg_catalog.pg_encoding_to_char(d.encoding) AS encoding "
                        + "FROM pg_catalog.pg_database d "
                        + "LEFT JOIN pg_catalog.pg_user u ON d.datdba = u.usesysid")
                .restrictionColumns("datname")
                .identifierParts(1)
                .build();
    }

    static CollectionDescriptor tables() {
        return CollectionDescriptor.builder(TABLES)
                .addTextColumn("table_catalog")
                .addTextColumn("table_schema")
                .addTextColumn("table_name")
                .addTextColumn("table_type")
                .queryTemplate("SELECT table_catalog, table_schema, table_name, table_type "
                        + "FROM information_schema.tables")
                .restrictionColumns("table_catalog", "table_schema", "table_name", "table_type")
                .identifierParts(3)
                .build();
    }

    static CollectionDescriptor columns() {
        return CollectionDescriptor.builder(COLUMNS)
                .addTextColumn("table_catalog")
                .addTextColumn("table_schema")
                .addTextColumn("table_name")
                .addTextColumn("column_name")
                .addIntColumn("ordinal_position")
                .addTextColumn("column_default")
                .addTextColumn("is_nullable")
                .addTextColumn("data_type")
                .addIntColumn("character_maximum_length")
                .addIntColumn("character_octet_length")
                .addIntColumn("numeric_precision")
                .addIntColumn("numeric_precision_radix")
                .addIntColumn("numeric_scale")
                .addIntColumn("datetime_precision")
                .addTextColumn("character_set_catalog")
                .addTextColumn("character_set_schema")
                .addTextColumn("character_set_name")
                .addTextColumn("collation_catalog")
                .queryTemplate("SELECT table_catalog, table_schema, table_name, column_name, ordinal_position, "
                        + "column_default, is_nullable, udt_name AS data_type, character_maximum_length, "
                        + "character_octet_length, numeric_precision, numeric_precision_radix, numeric_scale, "
                        + "datetime_precision, character_set_catalog, character_set_schema, character_set_name, "
                        + "collation_catalog FROM information_schema.columns")
                .restrictionColumns("table_catalog", "table_schema", "table_name", "column_name")
                .identifierParts(4)
                .build();
    }

    static CollectionDescriptor views() {
        return CollectionDescriptor.builder(VIEWS)
                .addTextColumn("table_catalog")
                .addTextColumn("table_schema")
                .addTextColumn("table_name")
                .addTextColumn("check_option")
                .addTextColumn("is_updatable")
                .queryTemplate("SELECT table_catalog, table_schema, table_name, check_option, is_updatable "
                        + "FROM information_schema.views")
                .restrictionColumns("table_catalog", "table_schema", "table_name")
                .identifierParts(3)
                .build();
    }

    static CollectionDescriptor users() {
        return CollectionDescriptor.builder(USERS)
                .addTextColumn("user_name")
                .addLongColumn("user_sysid")
                .queryTemplate("SELECT usename AS user_name, usesysid AS user_sysid FROM pg_catalog.pg_user")
                .restrictionColumns("usename")
                .identifierParts(1)
                .build();
    }

    // The index templates select from a derived table so the restriction columns
    // are addressable by their output names. Both end in an open WHERE clause.

    static CollectionDescriptor indexes() {
        return CollectionDescriptor.builder(INDEXES)
                .addTextColumn("table_catalog")
                .addTextColumn("table_schema")
                .addTextColumn("table_name")
                .addTextColumn("index_name")
                .queryTemplate("SELECT table_catalog, table_schema, table_name, index_name FROM (\n"
                        + "SELECT DISTINCT current_database() AS table_catalog,\n"
                        + "    n.nspname AS table_schema,\n"
                        + "    t.relname AS table_name,\n"
                        + "    i.relname AS index_name\n"
                        + "FROM\n"
                        + "    pg_catalog.pg_class i JOIN\n"
                        + "    pg_catalog.pg_index ix ON ix.indexrelid = i.oid JOIN\n"
                        + "    pg_catalog.pg_class t ON ix.indrelid = t.oid JOIN\n"
                        + "    pg_catalog.pg_attribute a ON t.oid = a.attrelid LEFT JOIN\n"
                        + "    pg_catalog.pg_namespace n ON n.oid = i.relnamespace\n"
                        + "WHERE\n"
                        + "    i.relkind = 'i'\n"
                        + "    AND pg_catalog.pg_table_is_visible(i.oid)\n"
                        + "    AND a.attnum = ANY(ix.indkey)\n"
                        + "    AND t.relkind = 'r'\n"
                        + ") AS idx\n"
                        + "WHERE table_schema NOT IN ('pg_catalog', 'pg_toast')")
                .clauseMode(ClauseMode.AND)
                .restrictionColumns("table_catalog", "table_schema", "table_name", "index_name")
                .identifierParts(4)
                .build();
    }

    static CollectionDescriptor indexColumns() {
        return CollectionDescriptor.builder(INDEX_COLUMNS)
                .addTextColumn("table_catalog")
                .addTextColumn("table_schema")
                .addTextColumn("table_name")
                .addTextColumn("index_name")
                .addTextColumn("column_name")
                .queryTemplate("SELECT table_catalog, table_schema, table_name, index_name, column_name FROM (\n"
                        + "SELECT current_database() AS table_catalog,\n"
                        + "    n.nspname AS table_schema,\n"
                        + "    t.relname AS table_name,\n"
                        + "    i.relname AS index_name,\n"
                        + "    a.attname AS column_name\n"
                        + "FROM\n"
                        + "    pg_catalog.pg_class t JOIN\n"
                        + "    pg_catalog.pg_index ix ON t.oid = ix.indrelid JOIN\n"
                        + "    pg_catalog.pg_class i ON ix.indexrelid = i.oid JOIN\n"
                        + "    pg_catalog.pg_attribute a ON t.oid = a.attrelid LEFT JOIN\n"
                        + "    pg_catalog.pg_namespace n ON i.relnamespace = n.oid\n"
                        + "WHERE\n"
                        + "    i.relkind = 'i'\n"
                        + "    AND pg_catalog.pg_table_is_visible(i.oid)\n"
                        + "    AND a.attnum = ANY(ix.indkey)\n"
                        + "    AND t.relkind = 'r'\n"
                        + ") AS idx\n"
                        + "WHERE table_schema NOT IN ('pg_catalog', 'pg_toast')")
                .clauseMode(ClauseMode.AND)
                .restrictionColumns("table_catalog", "table_schema", "table_name", "index_name", "column_name")
                .identifierParts(5)
                .build();
    }
}
