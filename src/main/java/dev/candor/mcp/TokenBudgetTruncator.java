package dev.candor.mcp;

import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Fits formatted tool output blocks into a token budget.
 *
 * <p>Tokens are estimated as characters / 4. Blocks are appended in order until the next one would
 * exceed the budget; a trailing note reports how many were omitted. A first block that alone
 * exceeds the budget is cut at the character level so some output is always returned.
 */
@Component
public class TokenBudgetTruncator {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public TokenBudgetTruncator(@Value("${candor.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  public String truncate(String header, List<String> blocks) {
    StringBuilder output = new StringBuilder(header);
    int estimatedTokens = estimateTokens(header);

    for (int i = 0; i < blocks.size(); i++) {
      String block = blocks.get(i);
      int blockTokens = estimateTokens(block);

      if (i == 0 && estimatedTokens + blockTokens > tokenBudget) {
        int maxChars = (int) (Math.max(0, tokenBudget - estimatedTokens) * CHARS_PER_TOKEN);
        output.append(block, 0, Math.min(maxChars, block.length()));
        appendOmitted(output, blocks.size() - 1);
        return output.toString();
      }

      if (estimatedTokens + blockTokens > tokenBudget) {
        appendOmitted(output, blocks.size() - i);
        return output.toString();
      }

      output.append(block);
      estimatedTokens += blockTokens;
    }
    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private static void appendOmitted(StringBuilder output, int omitted) {
    if (omitted > 0) {
      output.append("\n(").append(omitted).append(" more omitted to fit the output budget)\n");
    }
  }
}
