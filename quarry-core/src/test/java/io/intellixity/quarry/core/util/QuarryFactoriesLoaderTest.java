package io.intellixity.quarry.core.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QuarryFactoriesLoaderTest {

  public interface Greeter {
    String greet();
  }

  public static final class Hello implements Greeter {
    @Override public String greet() { return "hello"; }
  }

  public static final class Hi implements Greeter {
    @Override public String greet() { return "hi"; }
  }

  public interface Unlisted {}

  @Test
  void loadsListedImplementationsInOrderWithoutDuplicates() {
    List<Greeter> gs = QuarryFactoriesLoader.load(Greeter.class);
    assertEquals(2, gs.size());
    assertEquals("hello", gs.get(0).greet());
    assertEquals("hi", gs.get(1).greet());
  }

  @Test
  void unknownKeyYieldsEmptyList() {
    assertTrue(QuarryFactoriesLoader.load(Unlisted.class).isEmpty());
  }
}
