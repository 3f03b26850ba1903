package com.afipvision.core.db;

import com.afipvision.app.Config;
import com.afipvision.core.ocr.Provider;
import com.afipvision.core.ocr.ProviderQuotaStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Дневные счётчики провайдеров в PostgreSQL (таблица provider_usage).
 * Инкремент атомарен за счёт INSERT ... ON CONFLICT DO UPDATE ... RETURNING, поэтому несколько
 * процессов могут делить одну квоту. Сброс счётчиков — дело внешнего планировщика: новый день
 * просто начинает новую строку.
 */
public final class PgQuotaStore implements ProviderQuotaStore, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PgQuotaStore.class);

    private final HikariDataSource ds;
    private final Clock clock;

    public PgQuotaStore(Config.Db db) {
        this(db, Clock.systemDefaultZone());
    }

    public PgQuotaStore(Config.Db db, Clock clock) {
        Objects.requireNonNull(db, "db");
        if (db.url() == null || db.url().isBlank()) {
            throw new IllegalStateException("db.url is required for quota.store=postgres");
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(db.url());
        hc.setUsername(db.user());
        hc.setPassword(db.pass());
        hc.setMaximumPoolSize(4);
        hc.setMinimumIdle(1);
        hc.setPoolName("av-quota-pool");
        // быстрые таймауты: квота проверяется на каждый документ
        hc.setConnectionTimeout(5000);
        hc.setValidationTimeout(3000);
        hc.setIdleTimeout(300000);
        hc.setMaxLifetime(1800000);
        hc.setConnectionTestQuery("SELECT 1");
        this.ds = new HikariDataSource(hc);
        log.info("Pg: quota pool started url={}", db.url());
        try {
            Flyway.configure()
                    .dataSource(ds)
                    .locations("classpath:db/migration")
                    .baselineOnMigrate(true)
                    .load()
                    .migrate();
        } catch (RuntimeException e) {
            ds.close();
            throw e;
        }
        log.info("Pg: flyway migrate done");
    }

    @Override
    public int increment(Provider provider) {
        final String sql = """
        INSERT INTO provider_usage(provider, day, used)
        VALUES (?, ?, 1)
        ON CONFLICT(provider, day) DO UPDATE
          SET used = provider_usage.used + 1
        RETURNING used
        """;
        Objects.requireNonNull(provider, "provider");
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, provider.name());
            ps.setDate(2, Date.valueOf(today()));
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return rs.getInt(1);
            }
            throw new RuntimeException("increment returned no row for " + provider);
        } catch (SQLException e) {
            throw new RuntimeException("increment failed for " + provider + " sqlstate=" + e.getSQLState(), e);
        }
    }

    @Override
    public int currentCount(Provider provider) {
        final String sql = "SELECT used FROM provider_usage WHERE provider = ? AND day = ?";
        Objects.requireNonNull(provider, "provider");
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, provider.name());
            ps.setDate(2, Date.valueOf(today()));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("currentCount failed for " + provider + " sqlstate=" + e.getSQLState(), e);
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    @Override
    public void close() {
        ds.close();
        log.info("Pg: quota pool closed");
    }
}
