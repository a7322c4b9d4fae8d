/**
 * Statement logging facade with levels and a slow-query decorator.
 *
 * <p>{@link dbmanager.log.DefaultDbLogger} writes through {@code java.util.logging};
 * {@link dbmanager.log.SlowQueryLogger} wraps any {@link dbmanager.log.DbLogger} and reports
 * statements at or above its threshold.
 */
package dbmanager.log;
