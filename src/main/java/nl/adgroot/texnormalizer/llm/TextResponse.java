package nl.adgroot.texnormalizer.llm;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;

/** A model answer held as plain text. */
public record TextResponse(String content) implements CodeBlockResponse {

  @Override
  public Optional<String> firstCodeBlock(String language) {
    if (content == null || content.isEmpty()) {
      return Optional.empty();
    }

    Pattern fence = Pattern.compile("```" + Pattern.quote(language) + "\\s*(.*?)```", Pattern.DOTALL);
    Matcher m = fence.matcher(content);
    return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
  }

  @NotNull
  @Override
  public String toString() {
    return content == null ? "" : content;
  }
}
