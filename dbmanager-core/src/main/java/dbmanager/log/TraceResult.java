package dbmanager.log;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;

/**
 * What a traced statement did: its text, its bound parameters and the affected row count.
 * Produced lazily, only when a logger actually writes the trace.
 *
 * @param sql          statement text with {@code ?} placeholders
 * @param params       bound parameters in placeholder order, never {@code null}
 * @param rowsAffected affected rows for updates, returned rows for queries, {@code -1} if unknown
 */
public record TraceResult(String sql, List<Object> params, long rowsAffected) {

  public TraceResult {
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static TraceResult of(String sql, long rowsAffected) {
    return new TraceResult(sql, List.of(), rowsAffected);
  }

  /**
   * Statement text, with parameter values substituted for the placeholders when
   * {@code inlineParams} is set. Placeholders inside quoted literals are left alone.
   */
  public String render(boolean inlineParams) {
    if (!inlineParams || params.isEmpty() || sql == null) {
      return sql;
    }
    StringBuilder out = new StringBuilder(sql.length() + params.size() * 8);
    int next = 0;
    boolean inQuote = false;
    for (int i = 0; i < sql.length(); i++) {
      char c = sql.charAt(i);
      if (c == '\'') {
        inQuote = !inQuote;
      }
      if (c == '?' && !inQuote && next < params.size()) {
        out.append(literal(params.get(next++)));
      } else {
        out.append(c);
      }
    }
    return out.toString();
  }

  private static String literal(Object value) {
    if (value == null) {
      return "NULL";
    }
    if (value instanceof Number || value instanceof Boolean) {
      return value.toString();
    }
    if (value instanceof byte[] bytes) {
      return "<binary " + bytes.length + " bytes>";
    }
    if (value instanceof Date || value instanceof TemporalAccessor || value instanceof CharSequence
        || value instanceof Character || value instanceof Enum<?>) {
      return "'" + value.toString().replace("'", "''") + "'";
    }
    return "'" + value + "'";
  }
}
