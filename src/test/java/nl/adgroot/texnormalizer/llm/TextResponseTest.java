package nl.adgroot.texnormalizer.llm;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;

import org.junit.jupiter.api.Test;

class TextResponseTest {

  @Test
  void firstCodeBlock_returnsFirstMatchingFence_stripped() {
    TextResponse response = new TextResponse("""
        ```python
        print(1)
        ```
        ```latex
          \\frametitle{One}
        ```
        ```latex
        \\frametitle{Two}
        ```""");

    assertEquals(Optional.of("\\frametitle{One}"), response.firstCodeBlock("latex"));
    assertEquals(Optional.of("print(1)"), response.firstCodeBlock("python"));
  }

  @Test
  void firstCodeBlock_missingLanguageOrContent_isEmpty() {
    assertTrue(new TextResponse("```python\nx\n```").firstCodeBlock("latex").isEmpty());
    assertTrue(new TextResponse("").firstCodeBlock("latex").isEmpty());
    assertTrue(new TextResponse(null).firstCodeBlock("latex").isEmpty());
  }

  @Test
  void toString_isTheRawContent() {
    assertEquals("answer", new TextResponse("answer").toString());
    assertEquals("", new TextResponse(null).toString());
  }
}
