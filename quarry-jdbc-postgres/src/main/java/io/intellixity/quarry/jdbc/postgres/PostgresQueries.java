package io.intellixity.quarry.jdbc.postgres;

final class PostgresQueries {
  private PostgresQueries() {}

  static final String LIST_TABLES = """
      SELECT
          table_schema AS schema,
          table_name AS name,
          CASE
              WHEN table_type = 'BASE TABLE' THEN 'table'
              WHEN table_type = 'VIEW' THEN 'view'
              ELSE 'table'
          END AS type
      FROM information_schema.tables
      WHERE table_schema NOT IN ('pg_catalog', 'information_schema')
      ORDER BY table_schema, table_name
      """;

  static final String COLUMNS = """
      SELECT
          c.column_name AS name,
          c.data_type AS type,
          c.is_nullable = 'YES' AS nullable,
          c.column_default AS default_value,
          EXISTS(
              SELECT 1 FROM information_schema.table_constraints tc
              JOIN information_schema.key_column_usage kcu
                ON tc.constraint_name = kcu.constraint_name
              WHERE tc.table_schema = c.table_schema
                AND tc.table_name = c.table_name
                AND kcu.column_name = c.column_name
                AND tc.constraint_type = 'PRIMARY KEY'
          ) AS primary_key
      FROM information_schema.columns c
      WHERE c.table_schema = ?
        AND c.table_name = ?
      ORDER BY c.ordinal_position
      """;

  static final String INDEXES = """
      SELECT
          i.indexname AS name,
          array_agg(a.attname::text)::text[] AS columns,
          idx.indisunique AS is_unique,
          idx.indisprimary AS is_primary
      FROM pg_indexes i
      JOIN pg_namespace n ON n.nspname = i.schemaname
      JOIN pg_class c ON c.relname = i.indexname AND c.relnamespace = n.oid
      JOIN pg_index idx ON idx.indexrelid = c.oid
      JOIN pg_attribute a ON a.attrelid = idx.indrelid AND a.attnum = ANY(idx.indkey)
      WHERE i.schemaname = ?
        AND i.tablename = ?
      GROUP BY i.indexname, idx.indisunique, idx.indisprimary
      ORDER BY i.indexname
      """;

  static final String FOREIGN_KEYS = """
      SELECT
          tc.constraint_name AS name,
          kcu.column_name AS column_name,
          ccu.table_name AS references_table,
          ccu.column_name AS references_column
      FROM information_schema.table_constraints tc
      JOIN information_schema.key_column_usage kcu
        ON tc.constraint_name = kcu.constraint_name
       AND tc.table_schema = kcu.table_schema
      JOIN information_schema.constraint_column_usage ccu
        ON tc.constraint_name = ccu.constraint_name
      WHERE tc.constraint_type = 'FOREIGN KEY'
        AND tc.table_schema = ?
        AND tc.table_name = ?
      """;

  /** One row per table with columns, foreign keys and indexes aggregated as JSON. */
  static final String SCHEMA_OVERVIEW = """
      WITH columns_data AS (
          SELECT
              c.table_schema,
              c.table_name,
              json_agg(json_build_object(
                  'name', c.column_name,
                  'type', c.data_type,
                  'nullable', c.is_nullable = 'YES',
                  'default', c.column_default,
                  'primary_key', pk.column_name IS NOT NULL
              ) ORDER BY c.ordinal_position) AS columns
          FROM information_schema.columns c
          LEFT JOIN (
              SELECT ku.table_schema, ku.table_name, ku.column_name
              FROM information_schema.table_constraints tc
              JOIN information_schema.key_column_usage ku
                ON tc.constraint_name = ku.constraint_name
               AND tc.table_schema = ku.table_schema
              WHERE tc.constraint_type = 'PRIMARY KEY'
          ) pk ON c.table_schema = pk.table_schema
              AND c.table_name = pk.table_name
              AND c.column_name = pk.column_name
          WHERE c.table_schema NOT IN ('pg_catalog', 'information_schema')
          GROUP BY c.table_schema, c.table_name
      ),
      foreign_keys_data AS (
          SELECT
              tc.table_schema,
              tc.table_name,
              json_agg(json_build_object(
                  'name', tc.constraint_name,
                  'column', kcu.column_name,
                  'references_table', ccu.table_name,
                  'references_column', ccu.column_name
              )) AS foreign_keys
          FROM information_schema.table_constraints tc
          JOIN information_schema.key_column_usage kcu
            ON tc.constraint_name = kcu.constraint_name
           AND tc.table_schema = kcu.table_schema
          JOIN information_schema.constraint_column_usage ccu
            ON ccu.constraint_name = tc.constraint_name
          WHERE tc.constraint_type = 'FOREIGN KEY'
            AND tc.table_schema NOT IN ('pg_catalog', 'information_schema')
          GROUP BY tc.table_schema, tc.table_name
      ),
      indexes_data AS (
          SELECT
              schemaname AS table_schema,
              tablename AS table_name,
              json_agg(json_build_object(
                  'name', indexname,
                  'columns', regexp_split_to_array(substring(indexdef from '\\((.*)\\)'), ', '),
                  'unique', indexdef LIKE '%UNIQUE%',
                  'primary', indexname LIKE '%_pkey'
              )) AS indexes
          FROM pg_indexes
          WHERE schemaname NOT IN ('pg_catalog', 'information_schema')
          GROUP BY schemaname, tablename
      )
      SELECT
          cd.table_schema AS schema,
          cd.table_name AS name,
          'table' AS type,
          cd.columns::text AS columns,
          COALESCE(fk.foreign_keys, '[]'::json)::text AS foreign_keys,
          COALESCE(idx.indexes, '[]'::json)::text AS indexes
      FROM columns_data cd
      LEFT JOIN foreign_keys_data fk
        ON cd.table_schema = fk.table_schema
       AND cd.table_name = fk.table_name
      LEFT JOIN indexes_data idx
        ON cd.table_schema = idx.table_schema
       AND cd.table_name = idx.table_name
      ORDER BY cd.table_schema, cd.table_name
      """;
}
