package dev.candor.mcp;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class TokenBudgetTruncatorTest {

  @Test
  void blocksWithinBudgetAreAllIncluded() {
    var truncator = new TokenBudgetTruncator(5000);

    String output = truncator.truncate("Header:\n", List.of("first\n", "second\n"));

    assertThat(output).isEqualTo("Header:\nfirst\nsecond\n");
  }

  @Test
  void blocksBeyondBudgetAreOmittedWithNote() {
    // 50 tokens = ~200 chars; each block is 80 chars.
    var truncator = new TokenBudgetTruncator(50);
    String block = "x".repeat(79) + "\n";

    String output = truncator.truncate("", List.of(block, block, block, block));

    assertThat(output).startsWith(block + block);
    assertThat(output).doesNotContain(block + block + block);
    assertThat(output).contains("(2 more omitted to fit the output budget)");
  }

  @Test
  void oversizedFirstBlockIsCutAtCharacterLevel() {
    // Budget of 10 tokens = 40 chars, header takes 1 token.
    var truncator = new TokenBudgetTruncator(10);

    String output = truncator.truncate("Head", List.of("y".repeat(500), "second"));

    assertThat(output).startsWith("Head" + "y".repeat(36));
    assertThat(output).doesNotContain("y".repeat(37));
    assertThat(output).doesNotContain("second");
    assertThat(output).contains("(1 more omitted");
  }

  @Test
  void noBlocksReturnsHeaderOnly() {
    var truncator = new TokenBudgetTruncator(5000);

    assertThat(truncator.truncate("Nothing here.\n", List.of())).isEqualTo("Nothing here.\n");
  }

  @Test
  void tokenEstimateRoundsUp() {
    var truncator = new TokenBudgetTruncator(5000);

    assertThat(truncator.estimateTokens("")).isZero();
    assertThat(truncator.estimateTokens("abcd")).isEqualTo(1);
    assertThat(truncator.estimateTokens("abcde")).isEqualTo(2);
    assertThat(truncator.getTokenBudget()).isEqualTo(5000);
  }
}
