package com.property.distress.store.jdbc;

import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.support.KeyHolder;

import java.util.Map;

/**
 * Reads the generated id from a key holder. H2 returns only the identity column,
 * PostgreSQL returns the whole row, and the column name case differs between them.
 */
final class JdbcKeys {

    private JdbcKeys() {
    }

    static long generatedId(KeyHolder keyHolder) {
        Map<String, Object> keys = keyHolder.getKeys();
        if (keys != null) {
            for (Map.Entry<String, Object> entry : keys.entrySet()) {
                if ("id".equalsIgnoreCase(entry.getKey()) && entry.getValue() instanceof Number n) {
                    return n.longValue();
                }
            }
        }
        throw new DataRetrievalFailureException("No generated id returned, keys=" + keys);
    }
}
