package com.gpuopt.infrastructure.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Statement;

/** Schema initialization (idempotent). */
public final class SqliteSchema {

    private static final Logger log = LoggerFactory.getLogger(SqliteSchema.class);

    private SqliteSchema() {}

    static final String DDL = """
        CREATE TABLE IF NOT EXISTS customers (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          email TEXT NOT NULL UNIQUE,
          api_key TEXT NOT NULL UNIQUE,
          subscription_tier TEXT NOT NULL DEFAULT 'free',
          gpu_count INTEGER NOT NULL DEFAULT 0,
          monthly_savings REAL NOT NULL DEFAULT 0,
          created_at TEXT NOT NULL,
          last_payment TEXT
        );

        CREATE INDEX IF NOT EXISTS idx_customers_tier ON customers(subscription_tier);
        CREATE INDEX IF NOT EXISTS idx_customers_created ON customers(created_at);

        CREATE TABLE IF NOT EXISTS revenue_events (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          event_type TEXT NOT NULL,
          customer_email TEXT NOT NULL,
          amount TEXT NOT NULL,
          metadata TEXT,
          created_at TEXT NOT NULL
        );

        CREATE INDEX IF NOT EXISTS idx_revenue_events_email ON revenue_events(customer_email);

        CREATE TABLE IF NOT EXISTS gpu_usage_logs (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          customer_email TEXT NOT NULL,
          gpu_index INTEGER NOT NULL,
          gpu_name TEXT NOT NULL,
          utilization REAL NOT NULL,
          memory_used REAL NOT NULL,
          memory_total REAL NOT NULL,
          cost_per_hour REAL NOT NULL,
          potential_savings REAL NOT NULL,
          recorded_at TEXT NOT NULL
        );

        CREATE INDEX IF NOT EXISTS idx_usage_email_time ON gpu_usage_logs(customer_email, recorded_at);

        CREATE TABLE IF NOT EXISTS payment_transactions (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          payment_id TEXT NOT NULL,
          customer_email TEXT NOT NULL,
          gateway TEXT NOT NULL,
          plan TEXT NOT NULL,
          amount TEXT NOT NULL,
          currency TEXT NOT NULL,
          status TEXT NOT NULL DEFAULT 'pending',
          metadata TEXT,
          created_at TEXT NOT NULL,
          updated_at TEXT NOT NULL,
          UNIQUE(gateway, payment_id)
        );

        CREATE INDEX IF NOT EXISTS idx_payments_status_created ON payment_transactions(status, created_at);

        CREATE TABLE IF NOT EXISTS blocked_ips (
          ip TEXT PRIMARY KEY,
          reason TEXT,
          blocked_at TEXT NOT NULL,
          expires_at TEXT,
          is_active INTEGER NOT NULL DEFAULT 1
        );

        CREATE TABLE IF NOT EXISTS api_usage_logs (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          customer_email TEXT,
          api_key TEXT,
          endpoint TEXT NOT NULL,
          method TEXT NOT NULL,
          ip TEXT,
          user_agent TEXT,
          status_code INTEGER NOT NULL,
          duration_ms INTEGER NOT NULL,
          created_at TEXT NOT NULL
        );

        CREATE INDEX IF NOT EXISTS idx_api_usage_created ON api_usage_logs(created_at);
        """;

    public static void init(ResourcePool pool) {
        pool.withConnection(c -> {
            try (Statement st = c.createStatement()) {
                for (String ddl : DDL.split(";")) {
                    if (!ddl.isBlank()) st.execute(ddl);
                }
            }
            return null;
        });
        log.info("SQLite schema ready");
    }
}
