package dbmanager.jdbc.pool;

import com.zaxxer.hikari.HikariConfigMXBean;
import dbmanager.jdbc.engine.JdbcTarget;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Logger;

/**
 * Physical-connection source handed to HikariCP. Connections come from {@link DriverManager};
 * each one is wrapped so that its physical close is attributed to a reason:
 * <ul>
 *   <li>lifetime: the connection reached the pool's max lifetime</li>
 *   <li>idle time: retired by the idle timeout</li>
 *   <li>idle count: retired because the pool holds more idle connections than it keeps</li>
 * </ul>
 * Closes during pool shutdown are not counted.
 */
final class TrackingDataSource implements DataSource {

  enum CloseReason { LIFETIME, IDLE_TIME, IDLE_COUNT }

  private final JdbcTarget target;
  private final LongAdder lifetimeClosed = new LongAdder();
  private final LongAdder idleTimeClosed = new LongAdder();
  private final LongAdder idleCountClosed = new LongAdder();
  private volatile HikariConfigMXBean poolConfig;
  private volatile boolean shuttingDown;
  private volatile int loginTimeoutSeconds;
  private volatile PrintWriter logWriter;

  TrackingDataSource(JdbcTarget target) {
    this.target = target;
  }

  /** Binds the live pool configuration used to classify closes. */
  void bind(HikariConfigMXBean poolConfig) {
    this.poolConfig = poolConfig;
  }

  void markShutdown() {
    shuttingDown = true;
  }

  long lifetimeClosed() {
    return lifetimeClosed.sum();
  }

  long idleTimeClosed() {
    return idleTimeClosed.sum();
  }

  long idleCountClosed() {
    return idleCountClosed.sum();
  }

  /**
   * HikariCP shortens each connection's lifetime by up to 2.5% to avoid mass retirement, so
   * anything that old counts as a lifetime close. The idle timeout only retires connections
   * while the pool keeps fewer idle connections than its maximum size.
   */
  static CloseReason classify(long ageMillis, long maxLifetimeMillis, long idleTimeoutMillis,
                              int minimumIdle, int maximumPoolSize) {
    if (maxLifetimeMillis > 0 && ageMillis >= maxLifetimeMillis - maxLifetimeMillis / 40) {
      return CloseReason.LIFETIME;
    }
    if (idleTimeoutMillis > 0 && minimumIdle < maximumPoolSize) {
      return CloseReason.IDLE_TIME;
    }
    return CloseReason.IDLE_COUNT;
  }

  private void recordClose(long openedAtMillis) {
    HikariConfigMXBean config = poolConfig;
    if (shuttingDown || config == null) {
      return;
    }
    long age = System.currentTimeMillis() - openedAtMillis;
    switch (classify(age, config.getMaxLifetime(), config.getIdleTimeout(),
        config.getMinimumIdle(), config.getMaximumPoolSize())) {
      case LIFETIME -> lifetimeClosed.increment();
      case IDLE_TIME -> idleTimeClosed.increment();
      case IDLE_COUNT -> idleCountClosed.increment();
    }
  }

  @Override
  public Connection getConnection() throws SQLException {
    Properties props = new Properties();
    if (target.username() != null) {
      props.setProperty("user", target.username());
    }
    if (target.password() != null) {
      props.setProperty("password", target.password());
    }
    return track(DriverManager.getConnection(target.jdbcUrl(), props));
  }

  @Override
  public Connection getConnection(String username, String password) throws SQLException {
    return track(DriverManager.getConnection(target.jdbcUrl(), username, password));
  }

  private Connection track(Connection physical) {
    return (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[] {Connection.class},
        new CloseRecorder(physical, System.currentTimeMillis()));
  }

  private final class CloseRecorder implements InvocationHandler {
    private final Connection physical;
    private final long openedAtMillis;
    private final AtomicBoolean closed = new AtomicBoolean();

    private CloseRecorder(Connection physical, long openedAtMillis) {
      this.physical = physical;
      this.openedAtMillis = openedAtMillis;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
      String name = method.getName();
      if (name.equals("close") && method.getParameterCount() == 0 && closed.compareAndSet(false, true)) {
        recordClose(openedAtMillis);
      } else if (name.equals("equals") && method.getParameterCount() == 1) {
        return proxy == args[0];
      } else if (name.equals("hashCode") && method.getParameterCount() == 0) {
        return System.identityHashCode(proxy);
      }
      try {
        return method.invoke(physical, args);
      } catch (InvocationTargetException e) {
        throw e.getCause();
      }
    }
  }

  @Override
  public PrintWriter getLogWriter() {
    return logWriter;
  }

  @Override
  public void setLogWriter(PrintWriter out) {
    this.logWriter = out;
  }

  @Override
  public void setLoginTimeout(int seconds) {
    this.loginTimeoutSeconds = seconds;
  }

  @Override
  public int getLoginTimeout() {
    return loginTimeoutSeconds;
  }

  @Override
  public Logger getParentLogger() {
    return Logger.getLogger(TrackingDataSource.class.getPackageName());
  }

  @Override
  public <T> T unwrap(Class<T> iface) throws SQLException {
    if (iface.isInstance(this)) {
      return iface.cast(this);
    }
    throw new SQLException("not a wrapper for " + iface.getName());
  }

  @Override
  public boolean isWrapperFor(Class<?> iface) {
    return iface.isInstance(this);
  }
}
