package io.github.wphillipmoore.system.override;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.AbstractMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.jspecify.annotations.Nullable;

/**
 * Builders for desired-override maps.
 *
 * <p>{@link Map#of} and {@link Map#entry} reject {@code null} values, but a {@code null} value is
 * how an override requests removal of a key. These factories accept them.
 *
 * <p>JSON sources are flat objects of string or {@code null} values, parsed with Gson:
 *
 * <pre>{@code
 * {"APP_MODE": "test", "HOME": null}
 * }</pre>
 */
public final class OverrideMaps {

  private OverrideMaps() {}

  /**
   * Returns a single-entry map.
   *
   * @param key the key, must not be null
   * @param value the value, or {@code null} to request removal
   * @return an unmodifiable map with one entry
   */
  public static Map<String, @Nullable String> of(String key, @Nullable String value) {
    Objects.requireNonNull(key, "key");
    return Collections.singletonMap(key, value);
  }

  /**
   * Returns an entry that may hold a {@code null} value.
   *
   * @param key the key, must not be null
   * @param value the value, or {@code null} to request removal
   * @return an immutable entry
   */
  public static Map.Entry<String, @Nullable String> entry(String key, @Nullable String value) {
    Objects.requireNonNull(key, "key");
    return new AbstractMap.SimpleImmutableEntry<>(key, value);
  }

  /**
   * Collects entries into a map. Later entries win for duplicate keys.
   *
   * @param entries the entries, must not be null
   * @return an unmodifiable map in entry order
   */
  public static Map<String, @Nullable String> fromEntries(
      List<? extends Map.Entry<String, ? extends @Nullable String>> entries) {
    Objects.requireNonNull(entries, "entries");
    Map<String, @Nullable String> result = new LinkedHashMap<>();
    for (Map.Entry<String, ? extends @Nullable String> entry : entries) {
      result.put(Objects.requireNonNull(entry.getKey(), "key"), entry.getValue());
    }
    return Collections.unmodifiableMap(result);
  }

  /**
   * Copies a {@link Properties} instance into a map, converting entries with {@link
   * String#valueOf}.
   *
   * @param properties the properties, must not be null
   * @return an unmodifiable map
   */
  public static Map<String, String> fromProperties(Properties properties) {
    return Collections.unmodifiableMap(SystemPropertiesAccessor.toStringMap(properties));
  }

  /**
   * Parses a flat JSON object into a map.
   *
   * @param json the JSON text, must not be null or blank
   * @return an unmodifiable map in document order, JSON {@code null} mapped to {@code null}
   * @throws IllegalArgumentException if the text is blank, not a JSON object, or holds a value
   *     that is neither a string nor {@code null}
   */
  public static Map<String, @Nullable String> fromJson(String json) {
    Objects.requireNonNull(json, "json");
    if (json.isBlank()) {
      throw new IllegalArgumentException("json must not be empty");
    }
    JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Invalid override JSON", e);
    }
    return fromJsonElement(root);
  }

  /**
   * Loads a flat JSON object from a classpath resource (UTF-8).
   *
   * @param resourceName absolute resource name, as for {@link ClassLoader#getResource}
   * @return an unmodifiable map, as for {@link #fromJson}
   * @throws IllegalStateException if the resource cannot be found
   * @throws IllegalArgumentException if the resource is not a valid override object
   */
  public static Map<String, @Nullable String> fromResource(String resourceName) {
    Objects.requireNonNull(resourceName, "resourceName");
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = OverrideMaps.class.getClassLoader();
    }
    InputStream stream = loader.getResourceAsStream(resourceName);
    if (stream == null) {
      throw new IllegalStateException("Override resource not found: " + resourceName);
    }
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      return fromJsonElement(JsonParser.parseReader(reader));
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Invalid override JSON in " + resourceName, e);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read override resource: " + resourceName, e);
    }
  }

  private static Map<String, @Nullable String> fromJsonElement(JsonElement root) {
    if (!root.isJsonObject()) {
      throw new IllegalArgumentException("Override JSON must be an object");
    }
    JsonObject object = root.getAsJsonObject();
    Map<String, @Nullable String> result = new LinkedHashMap<>();
    for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
      JsonElement value = entry.getValue();
      if (value.isJsonNull()) {
        result.put(entry.getKey(), null);
      } else if (value.isJsonPrimitive() && ((JsonPrimitive) value).isString()) {
        result.put(entry.getKey(), value.getAsString());
      } else {
        throw new IllegalArgumentException(
            "Override value for " + entry.getKey() + " must be a string or null");
      }
    }
    return Collections.unmodifiableMap(result);
  }
}
