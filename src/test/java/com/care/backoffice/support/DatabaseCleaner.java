package com.care.backoffice.support;

import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/** Empties every table of the in-memory test database between tests. */
public final class DatabaseCleaner {

    private DatabaseCleaner() {
    }

    public static void clean(JdbcTemplate jdbc) {
        List<String> tables = jdbc.queryForList(
                "SELECT table_name FROM information_schema.tables "
                        + "WHERE lower(table_schema) = 'public' AND table_type = 'BASE TABLE'",
                String.class);
        jdbc.execute("SET REFERENTIAL_INTEGRITY FALSE");
        try {
            for (String table : tables) {
                jdbc.execute("TRUNCATE TABLE \"" + table + "\" RESTART IDENTITY");
            }
        } finally {
            jdbc.execute("SET REFERENTIAL_INTEGRITY TRUE");
        }
    }
}
