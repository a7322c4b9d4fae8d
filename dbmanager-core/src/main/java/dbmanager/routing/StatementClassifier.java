package dbmanager.routing;

import java.util.Locale;
import java.util.Set;

/**
 * Classifies SQL text for auto-routing by its leading keyword.
 *
 * <p>{@code SELECT}, {@code WITH}, {@code SHOW}, {@code EXPLAIN}, {@code DESCRIBE},
 * {@code DESC}, {@code VALUES} and {@code TABLE} are reads, unless the statement takes row locks
 * ({@code FOR UPDATE}, {@code FOR SHARE}, {@code LOCK IN SHARE MODE}) or is a {@code WITH}
 * that modifies data. Leading comments and parentheses are skipped.
 */
public final class StatementClassifier {
  private static final Set<String> READ_KEYWORDS =
      Set.of("SELECT", "WITH", "SHOW", "EXPLAIN", "DESCRIBE", "DESC", "VALUES", "TABLE");
  private static final Set<String> WRITE_KEYWORDS =
      Set.of("INSERT", "UPDATE", "DELETE", "MERGE", "REPLACE", "UPSERT", "CALL");

  private StatementClassifier() {
  }

  public static StatementKind classify(String sql) {
    if (sql == null) {
      return StatementKind.WRITE;
    }
    String keyword = leadingKeyword(sql);
    if (READ_KEYWORDS.contains(keyword)) {
      String upper = sql.toUpperCase(Locale.ROOT);
      if (upper.contains("FOR UPDATE") || upper.contains("FOR SHARE")
          || upper.contains("LOCK IN SHARE MODE")) {
        return StatementKind.WRITE;
      }
      if (keyword.equals("WITH") && modifiesData(upper)) {
        return StatementKind.WRITE;
      }
      return StatementKind.READ;
    }
    if (WRITE_KEYWORDS.contains(keyword)) {
      return StatementKind.WRITE;
    }
    return StatementKind.DDL;
  }

  private static boolean modifiesData(String upper) {
    for (String write : WRITE_KEYWORDS) {
      if (upper.matches("(?s).*\\b" + write + "\\b.*")) {
        return true;
      }
    }
    return false;
  }

  private static String leadingKeyword(String sql) {
    int i = 0;
    int n = sql.length();
    while (i < n) {
      char c = sql.charAt(i);
      if (Character.isWhitespace(c) || c == '(') {
        i++;
      } else if (sql.startsWith("--", i)) {
        int eol = sql.indexOf('\n', i);
        i = eol < 0 ? n : eol + 1;
      } else if (sql.startsWith("/*", i)) {
        int end = sql.indexOf("*/", i + 2);
        i = end < 0 ? n : end + 2;
      } else {
        break;
      }
    }
    int start = i;
    while (i < n && Character.isLetter(sql.charAt(i))) {
      i++;
    }
    return sql.substring(start, i).toUpperCase(Locale.ROOT);
  }
}
