package kvstore;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableNamesTest {

  @Test
  void validTableNameReturnsName() {
    assertEquals("main", TableNames.validate("main"));
    assertEquals("_users2", TableNames.validate("_users2"));
  }

  @Test
  void invalidTableNamesThrow() {
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1table"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("my-table"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("a.b"));
  }

  @Test
  void declareDefaultsToMainAndAppendsTimeout() {
    assertEquals(List.of("main", "timeout"), TableNames.declare(null));
    assertEquals(List.of("main", "timeout"), TableNames.declare(List.of()));
  }

  @Test
  void declareKeepsOrderAndRemovesDuplicates() {
    assertEquals(List.of("users", "main", "timeout"),
        TableNames.declare(List.of("users", "main", "users")));
  }

  @Test
  void timeoutDeclaredExplicitlyIsMovedLast() {
    assertEquals(List.of("main", "timeout"), TableNames.declare(List.of("timeout", "main")));
    assertEquals(List.of("main", "timeout"), TableNames.declare(List.of("timeout")));
  }
}
