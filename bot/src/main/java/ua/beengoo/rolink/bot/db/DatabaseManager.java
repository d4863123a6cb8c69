package ua.beengoo.rolink.bot.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import ua.beengoo.rolink.bot.config.RoLinkConfig;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Owns the connection pool for the {@code linkages} table and creates the table on start. */
@Slf4j
public class DatabaseManager {
    public enum Dialect {
        SQLITE("jdbc:sqlite:"),
        MYSQL("jdbc:mysql:", "jdbc:mariadb:"),
        POSTGRES("jdbc:postgresql:");

        private final String[] urlPrefixes;

        Dialect(String... urlPrefixes) {
            this.urlPrefixes = urlPrefixes;
        }

        public String migrationResource() {
            return "db/migration/" + name().toLowerCase(Locale.ROOT) + "/V1__init.sql";
        }

        /** Resolves from the JDBC url, or from {@code database.driver} when the url is not recognised. */
        public static Dialect of(String url, String driverHint) {
            String u = url == null ? "" : url.toLowerCase(Locale.ROOT);
            String d = driverHint == null ? "" : driverHint.toLowerCase(Locale.ROOT);
            for (Dialect dialect : values()) {
                for (String prefix : dialect.urlPrefixes) {
                    if (u.startsWith(prefix)) return dialect;
                }
            }
            for (Dialect dialect : values()) {
                if (!d.isBlank() && d.contains(dialect.name().toLowerCase(Locale.ROOT))) return dialect;
            }
            throw new IllegalStateException("Unsupported database url: " + url);
        }
    }

    private final RoLinkConfig.Database config;
    private HikariDataSource ds;
    private Dialect dialect;

    public DatabaseManager(RoLinkConfig.Database config) { this.config = config; }

    public void start() {
        this.dialect = Dialect.of(config.getUrl(), config.getDriver());

        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("rolink-db");
        cfg.setJdbcUrl(config.getUrl());
        if (config.getUsername() != null && !config.getUsername().isBlank()) cfg.setUsername(config.getUsername());
        if (config.getPassword() != null && !config.getPassword().isBlank()) cfg.setPassword(config.getPassword());
        cfg.setMaximumPoolSize(config.getPool().getMaxPoolSize());
        cfg.setKeepaliveTime(30_000);
        cfg.setConnectionTimeout(15_000);
        this.ds = new HikariDataSource(cfg);

        List<String> statements = statements(dialect.migrationResource());
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            for (String sql : statements) st.execute(sql);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create linkages table: " + e.getMessage(), e);
        }
        log.info("DB ready ({}, {} schema statements)", dialect, statements.size());
    }

    public void stop() {
        if (ds != null) ds.close();
    }

    public DataSource dataSource() { return ds; }

    public Dialect dialect() { return dialect; }

    /** Statements of a bundled script; each ends with {@code ;} at the end of a line. */
    static List<String> statements(String resource) {
        InputStream in = DatabaseManager.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) throw new IllegalStateException("Schema script not found: " + resource);

        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("--")) continue;
                if (trimmed.endsWith(";")) {
                    current.append(trimmed, 0, trimmed.length() - 1);
                    out.add(current.toString().trim());
                    current.setLength(0);
                } else {
                    current.append(trimmed).append(' ');
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource, e);
        }
        if (current.length() > 0) out.add(current.toString().trim());
        return out;
    }
}
