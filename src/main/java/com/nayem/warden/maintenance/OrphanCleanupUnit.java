package com.nayem.warden.maintenance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Deletes rows whose parent row no longer exists, e.g. messages left behind by
 * a deleted flow.
 * <p>
 * Runs a single {@code DELETE} through its own {@link JdbcTemplate}, so each
 * run borrows one short-lived connection from the pool. The JDBC query timeout
 * lets the database abandon the statement when the unit is timed out.
 * </p>
 */
public class OrphanCleanupUnit implements MaintenanceUnit {

    private static final Logger log = LoggerFactory.getLogger(OrphanCleanupUnit.class);
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private final Rule rule;
    private final JdbcTemplate jdbcTemplate;
    private final String sql;

    public OrphanCleanupUnit(DataSource dataSource, Rule rule, Duration queryTimeout) {
        this.rule = rule;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
        this.sql = "DELETE FROM " + rule.table()
                + " WHERE " + rule.column() + " IS NOT NULL"
                + " AND NOT EXISTS (SELECT 1 FROM " + rule.parentTable() + " p"
                + " WHERE p." + rule.parentColumn() + " = " + rule.table() + "." + rule.column() + ")";
    }

    @Override
    public String name() {
        return "orphans:" + rule.table();
    }

    @Override
    public int run() {
        int deleted = jdbcTemplate.update(sql);
        if (deleted > 0) {
            log.info("Deleted {} orphaned rows from {}", deleted, rule.table());
        }
        return deleted;
    }

    String sql() {
        return sql;
    }

    /**
     * Child table/column pointing at a parent table/column. All four names are
     * interpolated into SQL and must be plain identifiers.
     */
    public record Rule(String table, String column, String parentTable, String parentColumn) {

        public Rule {
            requireIdentifier("table", table);
            requireIdentifier("column", column);
            requireIdentifier("parentTable", parentTable);
            requireIdentifier("parentColumn", parentColumn);
        }

        private static void requireIdentifier(String field, String value) {
            if (value == null || !IDENTIFIER.matcher(value).matches()) {
                throw new IllegalArgumentException("Invalid SQL identifier for " + field + ": '" + value + "'");
            }
        }
    }
}
