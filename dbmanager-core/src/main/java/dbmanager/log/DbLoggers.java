package dbmanager.log;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Helpers shared by {@link DbLogger} implementations and by the code that calls them.
 */
public final class DbLoggers {
  private static final Logger logger = Logger.getLogger(DbLoggers.class.getName());

  private DbLoggers() {
  }

  /**
   * Runs a logging call; a failure of the logger is reported internally and never reaches the
   * operation being logged.
   */
  public static void emitQuietly(Runnable emission) {
    try {
      emission.run();
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Statement logger failed", e);
    }
  }

  /**
   * Renders {@code data} as {@code key=value} pairs separated by spaces. An odd trailing element
   * is appended as is. Returns an empty string for no data.
   */
  public static String formatFields(Object... data) {
    if (data == null || data.length == 0) {
      return "";
    }
    StringBuilder out = new StringBuilder();
    int i = 0;
    for (; i + 1 < data.length; i += 2) {
      if (out.length() > 0) {
        out.append(' ');
      }
      out.append(data[i]).append('=').append(data[i + 1]);
    }
    if (i < data.length) {
      if (out.length() > 0) {
        out.append(' ');
      }
      out.append(data[i]);
    }
    return out.toString();
  }

  /**
   * Joins a message with its formatted fields.
   */
  public static String withFields(String message, Object... data) {
    String fields = formatFields(data);
    return fields.isEmpty() ? message : message + " " + fields;
  }
}
