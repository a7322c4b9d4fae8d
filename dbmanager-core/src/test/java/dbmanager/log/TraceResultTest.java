package dbmanager.log;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TraceResultTest {

  @Test
  void inlinesParamsAsLiterals() {
    TraceResult r = new TraceResult("UPDATE t SET a = ?, b = ?, c = ?, d = ? WHERE id = ?",
        Arrays.asList("x", null, true, new byte[] {1, 2, 3}, 7L), 1);

    assertEquals("UPDATE t SET a = 'x', b = NULL, c = true, d = <binary 3 bytes> WHERE id = 7",
        r.render(true));
    assertEquals(r.sql(), r.render(false));
  }

  @Test
  void placeholdersInsideLiteralsAreKept() {
    TraceResult r = new TraceResult("SELECT '?' , ? FROM dual", List.of(5), 1);
    assertEquals("SELECT '?' , 5 FROM dual", r.render(true));
  }

  @Test
  void missingParamsLeavePlaceholders() {
    TraceResult r = new TraceResult("SELECT ?, ?", List.of(1), 1);
    assertEquals("SELECT 1, ?", r.render(true));
  }

  @Test
  void paramsAreCopied() {
    List<Object> params = new ArrayList<>(List.of(1));
    TraceResult r = new TraceResult("SELECT ?", params, 0);
    params.add(2);

    assertEquals(1, r.params().size());
    assertThrows(UnsupportedOperationException.class, () -> r.params().add(3));
    assertTrue(TraceResult.of("SELECT 1", 0).params().isEmpty());
  }
}
