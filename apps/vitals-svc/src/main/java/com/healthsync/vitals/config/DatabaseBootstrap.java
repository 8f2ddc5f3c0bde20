package com.healthsync.vitals.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies {@code db/schema.sql} when the database has not been initialized yet (samples table
 * missing) and {@code vitals.db.bootstrap-enabled} is set. Every statement is idempotent.
 */
@Component
public class DatabaseBootstrap {
    private static final Logger log = LoggerFactory.getLogger(DatabaseBootstrap.class);
    static final String SCHEMA_RESOURCE = "db/schema.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public DatabaseBootstrap(DataSource dataSource, VitalsProperties properties) {
        this.dataSource = dataSource;
        this.enabled = properties.db().bootstrapEnabled();
    }

    @PostConstruct
    void maybeBootstrap() {
        if (!enabled) {
            log.info("DB bootstrap disabled (vitals.db.bootstrap-enabled=false)");
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            if (samplesTableExists(conn)) {
                log.info("DB bootstrap skipped: schema already present (samples table exists)");
                return;
            }
            log.warn("DB bootstrap starting: applying {}", SCHEMA_RESOURCE);
            int applied = 0;
            for (String stmt : splitStatements(loadSchemaSql())) {
                try (Statement s = conn.createStatement()) {
                    s.execute(stmt);
                    applied++;
                } catch (SQLException ex) {
                    log.error("Failed executing bootstrap statement: {}", stmt, ex);
                    throw ex;
                }
            }
            log.info("DB bootstrap completed: {} statements applied", applied);
        } catch (SQLException | IOException e) {
            // startup continues; operators inspect the log
            log.error("DB bootstrap failed (application will continue to start)", e);
        }
    }

    private boolean samplesTableExists(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement(
                "select 1 from information_schema.tables where lower(table_name) = 'samples' and lower(table_schema) = 'public'")) {
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            log.warn("Could not check for existing tables: {}", e.getMessage());
            return false;
        }
    }

    private String loadSchemaSql() throws IOException {
        ClassPathResource res = new ClassPathResource(SCHEMA_RESOURCE);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        }
    }

    // Plain split on ';' is enough: the schema has no procedural blocks.
    static List<String> splitStatements(String sql) {
        return Arrays.stream(sql.split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
