package com.pgstress.pool;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reports how contended the shared HikariCP pool is.
 *
 * <p>Pressure (0.0-1.0) is the larger of pool utilization (active / total) and
 * a queue term driven by threads blocked in checkout:
 * <ul>
 *   <li>1.0 once the waiting threads reach the pool size</li>
 *   <li>0.7-1.0 when every connection is busy and threads are waiting</li>
 *   <li>0.5-0.7 when threads wait although the pool is not fully used</li>
 * </ul>
 *
 * <p>With the pool sized {@code threads + 2}, waiting threads during the
 * insert phase point at connections leaking or held by a stalled statement.
 */
@Component
public class ConnectionPoolMonitor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPoolMonitor.class);

    static final double HIGH_PRESSURE = 0.7;

    private final HikariDataSource dataSource;

    /**
     * Constructor for ConnectionPoolMonitor.
     *
     * @param dataSource the HikariCP data source
     * @param meterRegistry registry receiving the {@code stress.pool.pressure} gauge
     */
    public ConnectionPoolMonitor(HikariDataSource dataSource, MeterRegistry meterRegistry) {
        this.dataSource = dataSource;
        Gauge.builder("stress.pool.pressure", this, ConnectionPoolMonitor::pressure)
            .description("Connection pool pressure, 0.0 idle to 1.0 saturated")
            .register(meterRegistry);
    }

    /**
     * Takes a point-in-time view of the pool.
     *
     * @return the snapshot, all zeros before the pool has started
     */
    public PoolSnapshot snapshot() {
        HikariPoolMXBean poolBean = dataSource.getHikariPoolMXBean();
        if (poolBean == null) {
            return new PoolSnapshot(0, 0, 0, 0);
        }
        return new PoolSnapshot(
            poolBean.getActiveConnections(),
            poolBean.getIdleConnections(),
            poolBean.getTotalConnections(),
            poolBean.getThreadsAwaitingConnection());
    }

    public double pressure() {
        return snapshot().pressure();
    }

    /**
     * Logs the pool state, at WARN when pressure is high.
     *
     * @param phase the workload phase the snapshot belongs to
     * @return the logged snapshot
     */
    public PoolSnapshot logSnapshot(String phase) {
        PoolSnapshot snapshot = snapshot();
        double pressure = snapshot.pressure();
        if (pressure >= HIGH_PRESSURE && snapshot.threadsAwaiting() > 0) {
            log.warn("⚠️ Pool pressure during {}: active={}/{}, idle={}, waiting={}, pressure={}",
                phase, snapshot.active(), snapshot.total(), snapshot.idle(), snapshot.threadsAwaiting(),
                String.format("%.2f", pressure));
        } else {
            log.debug("Pool during {}: active={}/{}, idle={}, waiting={}, pressure={}",
                phase, snapshot.active(), snapshot.total(), snapshot.idle(), snapshot.threadsAwaiting(),
                String.format("%.2f", pressure));
        }
        return snapshot;
    }

    /**
     * Connection counts reported by the pool.
     */
    public record PoolSnapshot(int active, int idle, int total, int threadsAwaiting) {

        /**
         * Computes the pressure level for this snapshot.
         *
         * @return 0.0 to 1.0
         */
        public double pressure() {
            if (total == 0) {
                return 0.0;
            }
            double utilization = (double) active / total;
            double queuePressure;
            if (threadsAwaiting >= total) {
                queuePressure = 1.0;
            } else if (threadsAwaiting > 0 && active == total) {
                queuePressure = Math.min(1.0, 0.7 + 0.3 * Math.log(threadsAwaiting + 1) / Math.log(total + 1));
            } else if (threadsAwaiting > 0) {
                queuePressure = Math.min(0.7, 0.5 + 0.2 * Math.log(threadsAwaiting + 1) / Math.log(total + 1));
            } else {
                queuePressure = 0.0;
            }
            return Math.max(utilization, queuePressure);
        }
    }
}
