package nl.adgroot.texnormalizer.llm;

import java.util.Optional;

/**
 * What the slide pipeline needs from a chat-completion answer: its first fenced code block.
 * Keeps the rest of the code independent of any client library's response type.
 */
public interface CodeBlockResponse {

  /**
   * @param language fence tag, e.g. {@code latex} for a block opened with three backticks and latex
   * @return the trimmed block body, or empty when the answer has no such block
   */
  Optional<String> firstCodeBlock(String language);
}
