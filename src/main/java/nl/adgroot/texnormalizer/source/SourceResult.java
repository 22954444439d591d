package nl.adgroot.texnormalizer.source;

import java.util.Optional;

public record SourceResult(Status status, String latex, String reason) {

  public enum Status { AVAILABLE, UNAVAILABLE }

  public static SourceResult available(String latex) {
    return new SourceResult(Status.AVAILABLE, latex, null);
  }

  public static SourceResult unavailable(String reason) {
    return new SourceResult(Status.UNAVAILABLE, null, reason);
  }

  public boolean isAvailable() {
    return status == Status.AVAILABLE;
  }

  public Optional<String> latexIfAvailable() {
    return isAvailable() ? Optional.of(latex) : Optional.empty();
  }
}
