package com.ivamare.bulkload.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Warns when the connection pool cannot serve every worker of a pool at once.
 *
 * <p>Workers never coordinate on connections; a worker waiting for one simply
 * blocks, so an undersized pool shows up as idle workers rather than errors.
 */
public class ConnectionCapacityCheck {

    private static final Logger log = LoggerFactory.getLogger(ConnectionCapacityCheck.class);

    private final DataSource dataSource;

    public ConnectionCapacityCheck(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * @param pool pool name, for the log message
     * @param workers number of workers the pool will start
     * @return false if the data source is a Hikari pool smaller than {@code workers}
     */
    public boolean check(String pool, int workers) {
        HikariDataSource hikari = unwrap();
        if (hikari == null) {
            return true;
        }
        int max = hikari.getMaximumPoolSize();
        if (max < workers) {
            log.warn("Pool {} starts {} workers but the connection pool allows only {} connections; "
                + "{} workers will wait for a connection", pool, workers, max, workers - max);
            return false;
        }
        return true;
    }

    private HikariDataSource unwrap() {
        if (dataSource instanceof HikariDataSource hikari) {
            return hikari;
        }
        try {
            if (dataSource != null && dataSource.isWrapperFor(HikariDataSource.class)) {
                return dataSource.unwrap(HikariDataSource.class);
            }
        } catch (SQLException e) {
            log.debug("Could not unwrap data source: {}", e.getMessage());
        }
        return null;
    }
}
