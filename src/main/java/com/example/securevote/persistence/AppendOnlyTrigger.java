package com.example.securevote.persistence;

import org.h2.api.Trigger;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * H2 row trigger installed BEFORE UPDATE, DELETE on append-only tables (see schema-h2.sql).
 * Rejects the statement inside the database, so direct SQL access cannot rewrite history either.
 */
public class AppendOnlyTrigger implements Trigger {

    private String tableName;

    @Override
    public void init(Connection conn, String schemaName, String triggerName, String tableName,
                     boolean before, int type) {
        this.tableName = schemaName + "." + tableName;
    }

    @Override
    public void fire(Connection conn, Object[] oldRow, Object[] newRow) throws SQLException {
        if (oldRow != null) {
            String operation = newRow == null ? "DELETE" : "UPDATE";
            throw new SQLException(operation + " on append-only table " + tableName + " is not permitted", "45000");
        }
    }
}
