package nl.adgroot.texnormalizer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String DEFAULT_RESOURCE = "config.json";

  private ConfigLoader() {
    // utility class
  }

  public static AppConfig load(Path configPath) throws IOException {
    if (configPath == null || !Files.isRegularFile(configPath)) {
      throw new IOException("Config file not found: " + configPath);
    }
    try (InputStream in = Files.newInputStream(configPath)) {
      return read(in);
    }
  }

  /**
   * Loads {@code config.json} from the classpath, or the built-in defaults when it is absent.
   */
  public static AppConfig loadDefault() throws IOException {
    try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        return new AppConfig();
      }
      return read(in);
    }
  }

  private static AppConfig read(InputStream in) throws IOException {
    AppConfig cfg = MAPPER.readValue(in, AppConfig.class);
    return cfg == null ? new AppConfig() : cfg;
  }
}
