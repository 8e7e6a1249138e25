package com.example.datalake.docqa.config;

import com.pgvector.PGvector;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Register pgvector types with the JDBC driver so chunk and cache embeddings can be bound as
 * {@link PGvector} parameters.
 */
@Slf4j
@Configuration
@Profile("!test")
@RequiredArgsConstructor
public class PgvectorConfig {

    private final DataSource dataSource;

    @PostConstruct
    public void registerPgvectorTypes() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            String driverName = conn.getMetaData().getDriverName();
            boolean isPostgres = driverName != null && driverName.toLowerCase(Locale.ROOT).contains("postgresql");

            if (isPostgres) {
                PGvector.registerTypes(conn);
                log.info("Registered pgvector types on {}", driverName);
            } else {
                log.warn("Skip pgvector type registration for non-PostgreSQL driver: {}", driverName);
            }
        }
    }
}
