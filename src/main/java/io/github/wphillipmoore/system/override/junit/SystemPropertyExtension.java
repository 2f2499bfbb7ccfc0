package io.github.wphillipmoore.system.override.junit;

import io.github.wphillipmoore.system.override.OverrideMaps;
import io.github.wphillipmoore.system.override.ScopedOverride;
import io.github.wphillipmoore.system.override.SystemOverrideMode;
import io.github.wphillipmoore.system.override.SystemPropertiesAccessor;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

/**
 * Overrides system properties around each test.
 *
 * <p>Register it as an instance field so every test gets the override:
 *
 * <pre>{@code
 * @RegisterExtension
 * SystemPropertyExtension props = new SystemPropertyExtension("app.mode", "test");
 * }</pre>
 *
 * <p>The properties are restored after each test, whatever the test's outcome. See {@link
 * io.github.wphillipmoore.system.override.SystemProperties} for the override rules.
 */
public final class SystemPropertyExtension extends OverrideLifecycle
    implements BeforeEachCallback, AfterEachCallback {

  /** Overrides the given properties with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public SystemPropertyExtension(Map<String, ? extends @Nullable String> properties) {
    this(properties, SystemOverrideMode.ALLOW_OVERRIDE);
  }

  /** Overrides the given properties. */
  public SystemPropertyExtension(
      Map<String, ? extends @Nullable String> properties, SystemOverrideMode mode) {
    this(new ScopedOverride(new SystemPropertiesAccessor()), properties, mode);
  }

  /** Overrides the given properties with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public SystemPropertyExtension(
      List<? extends Map.Entry<String, ? extends @Nullable String>> properties) {
    this(entries(properties), SystemOverrideMode.ALLOW_OVERRIDE);
  }

  /** Overrides the given properties. Later entries win for duplicate keys. */
  public SystemPropertyExtension(
      List<? extends Map.Entry<String, ? extends @Nullable String>> properties,
      SystemOverrideMode mode) {
    this(entries(properties), mode);
  }

  /** Overrides one property with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public SystemPropertyExtension(String key, @Nullable String value) {
    this(single(key, value), SystemOverrideMode.ALLOW_OVERRIDE);
  }

  /** Overrides one property. */
  public SystemPropertyExtension(String key, @Nullable String value, SystemOverrideMode mode) {
    this(single(key, value), mode);
  }

  /** Overrides the given properties with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public SystemPropertyExtension(Properties properties) {
    this(OverrideMaps.fromProperties(properties), SystemOverrideMode.ALLOW_OVERRIDE);
  }

  /** Overrides the given properties. Entries are converted with {@link String#valueOf}. */
  public SystemPropertyExtension(Properties properties, SystemOverrideMode mode) {
    this(OverrideMaps.fromProperties(properties), mode);
  }

  /** Creates an extension over an injected override. Package-private for testing. */
  SystemPropertyExtension(
      ScopedOverride override,
      Map<String, ? extends @Nullable String> properties,
      SystemOverrideMode mode) {
    super(override, properties, mode);
  }

  @Override
  public void beforeEach(ExtensionContext context) {
    beforeScope();
  }

  @Override
  public void afterEach(ExtensionContext context) {
    afterScope();
  }
}
