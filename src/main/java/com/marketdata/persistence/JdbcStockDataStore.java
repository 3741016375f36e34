package com.marketdata.persistence;

import com.marketdata.pricing.StockPrice;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL implementation of {@link StockDataStore}. Writes the whole batch in one transaction;
 * an existing (symbol, date) row is overwritten and its {@code updated_at} refreshed.
 */
@Singleton
public class JdbcStockDataStore implements StockDataStore {
    private static final Logger LOG = LoggerFactory.getLogger(JdbcStockDataStore.class);

    static final String UPSERT_SQL = """
        INSERT INTO stock_data (symbol, date, open_price, high_price, low_price, close_price, volume)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (symbol, date)
        DO UPDATE SET
            open_price = EXCLUDED.open_price,
            high_price = EXCLUDED.high_price,
            low_price = EXCLUDED.low_price,
            close_price = EXCLUDED.close_price,
            volume = EXCLUDED.volume,
            updated_at = CURRENT_TIMESTAMP
        """;

    private final DataSource dataSource;

    public JdbcStockDataStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public boolean store(Map<String, List<StockPrice>> recordsBySymbol) {
        if (recordsBySymbol == null || recordsBySymbol.isEmpty()) {
            LOG.warn("No data to store");
            return false;
        }

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
                int totalRecords = 0;
                for (List<StockPrice> records : recordsBySymbol.values()) {
                    for (StockPrice record : records) {
                        ps.setString(1, record.symbol());
                        ps.setDate(2, Date.valueOf(record.date()));
                        ps.setDouble(3, record.open());
                        ps.setDouble(4, record.high());
                        ps.setDouble(5, record.low());
                        ps.setDouble(6, record.close());
                        ps.setLong(7, record.volume());
                        ps.addBatch();
                        totalRecords++;
                    }
                }
                ps.executeBatch();
                conn.commit();
                LOG.info("Successfully stored {} records", totalRecords);
                return true;
            } catch (SQLException e) {
                rollback(conn);
                throw e;
            }
        } catch (SQLException e) {
            LOG.error("Database error: {}", e.getMessage(), e);
            return false;
        }
    }

    private void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            LOG.error("Rollback failed", e);
        }
    }
}
