package com.hydrowatch.detection.rules;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RuleCascade Tests")
class RuleCascadeTest {

  private final RuleCascade<Integer, String> sizes = RuleCascade.<Integer, String>builder()
      .when("tiny", n -> n < 1, "tiny")
      .when("small", n -> n < 10, n -> "small:" + n)
      .otherwise("large")
      .build();

  @Test
  @DisplayName("First matching rule wins even when later rules also match")
  void firstMatchWins() {
    assertEquals("tiny", sizes.evaluate(0));
    assertEquals("small:5", sizes.evaluate(5));
  }

  @Test
  @DisplayName("Fallback applies when no rule matches")
  void fallbackWhenNothingMatches() {
    assertEquals("large", sizes.evaluate(42));
  }

  @Test
  @DisplayName("match ignores the fallback")
  void matchIgnoresFallback() {
    assertTrue(sizes.match(42).isEmpty());
    assertEquals("tiny", sizes.match(-3).orElseThrow());
    assertEquals("small", sizes.firstMatch(3).orElseThrow().name());
  }

  @Test
  @DisplayName("evaluate without fallback fails when nothing matches")
  void evaluateWithoutFallback() {
    RuleCascade<Integer, String> noFallback = RuleCascade.<Integer, String>builder()
        .when("negative", n -> n < 0, "negative")
        .build();
    assertThrows(IllegalStateException.class, () -> noFallback.evaluate(1));
  }

  @Test
  @DisplayName("Rule names keep declaration order")
  void ruleNamesInOrder() {
    assertEquals(List.of("tiny", "small"), sizes.ruleNames());
  }
}
