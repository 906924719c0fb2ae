package com.dreambig.chat.server.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Runs a classpath SQL script, one statement per {@code ;}. Statements must be idempotent.
 */
public final class SchemaInitializer {
    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    private SchemaInitializer() {}

    public static void apply(DataSource dataSource, String resource) {
        String script;
        try (InputStream in = SchemaInitializer.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("failed to read " + resource, e);
        }

        int executed = 0;
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            for (String sql : script.split(";")) {
                String trimmed = stripComments(sql).trim();
                if (trimmed.isEmpty()) continue;
                st.execute(trimmed);
                executed++;
            }
        } catch (SQLException e) {
            throw new MessageStoreException("schema init failed: " + resource, e);
        }
        log.info("[DB] applied {} ({} statements)", resource, executed);
    }

    private static String stripComments(String sql) {
        StringBuilder sb = new StringBuilder();
        for (String line : sql.split("\n")) {
            if (line.trim().startsWith("--")) continue;
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
