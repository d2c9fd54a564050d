package io.intellixity.quarry.jdbc.postgres;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Pools that were replaced after a transport error. A retired pool hands out no new connections but
 * is only closed once its borrowed connections are back, so queries running on other threads finish.
 */
final class RetiredPools {
  private static final Logger log = LoggerFactory.getLogger(RetiredPools.class);

  private final List<HikariDataSource> draining = new ArrayList<>();

  /** Evicts idle connections now, busy ones when they are returned. */
  synchronized void retire(HikariDataSource ds) {
    HikariPoolMXBean bean = ds.getHikariPoolMXBean();
    if (bean != null) bean.softEvictConnections();
    int active = active(ds);
    if (active == 0) {
      ds.close();
    } else {
      log.debug("quarry.pg pool_draining name={} active={}", ds.getPoolName(), active);
      draining.add(ds);
    }
  }

  /** Closes every retired pool whose connections have all been returned. */
  synchronized void sweep() {
    draining.removeIf(ds -> {
      if (active(ds) > 0) return false;
      ds.close();
      return true;
    });
  }

  /** Closes everything left, busy or not. */
  synchronized void closeAll() {
    draining.forEach(HikariDataSource::close);
    draining.clear();
  }

  synchronized int size() { return draining.size(); }

  private static int active(HikariDataSource ds) {
    HikariPoolMXBean bean = ds.getHikariPoolMXBean();
    return bean == null ? 0 : bean.getActiveConnections();
  }
}
