package ca.gc.cra.spanner.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads spanner configuration from YAML and flattens it into dotted key/value pairs.
 *
 * <p>A document holds a {@code common} section and any number of profile sections; the requested profile
 * is layered over {@code common}. Nested mappings flatten to dotted keys, so
 * {@code metrics: {exporter: otlp}} becomes {@code metrics.exporter=otlp}.</p>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and merges {@code common} with the {@code profile} section.
   *
   * @param path YAML file
   * @param profile profile section name, matched case-insensitively
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or has an unsupported shape
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(profile, "profile");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, path.toString(), profile));
    }
  }

  /**
   * Loads a classpath resource and merges {@code common} with the {@code profile} section.
   *
   * @param resource resource name, resolved against the loader's class loader
   * @param profile profile section name
   * @return flattened settings, or empty when the resource is absent
   * @throws IOException when the resource cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or has an unsupported shape
   */
  public static Optional<Map<String, String>> loadResource(String resource, String profile) throws IOException {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(profile, "profile");
    InputStream in = YamlConfigLoader.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      return Optional.empty();
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, "classpath:" + resource, profile));
    }
  }

  static Map<String, String> parse(Reader reader, String source, String profile) {
    String normalizedProfile = profile.trim().toLowerCase(Locale.ROOT);
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + source, ex);
    }
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> root = asMap(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    Object common = findSection(root, COMMON_SECTION);
    if (common != null) {
      flatten(asMap(common, COMMON_SECTION), "", flattened);
    }
    if (!normalizedProfile.equals(COMMON_SECTION)) {
      Object section = findSection(root, normalizedProfile);
      if (section != null) {
        flatten(asMap(section, normalizedProfile), "", flattened);
      }
    }
    return Map.copyOf(flattened);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
