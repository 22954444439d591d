package nl.adgroot.texnormalizer.tex.records;

import org.jetbrains.annotations.NotNull;

public record DefinitionRecord(Kind kind, String text, int offset) {

  public enum Kind { MACRO_DEFINITION, PACKAGE_DECLARATION }

  @NotNull
  @Override
  public String toString() {
    return text;
  }
}
