package io.github.wphillipmoore.system.override.junit;

import io.github.wphillipmoore.system.override.EnvironmentAccessor;
import io.github.wphillipmoore.system.override.ScopedOverride;
import io.github.wphillipmoore.system.override.SystemOverrideMode;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

/**
 * Overrides environment variables around each test.
 *
 * <p>Register it as an instance field so every test gets the override:
 *
 * <pre>{@code
 * @RegisterExtension
 * SystemEnvironmentExtension env = new SystemEnvironmentExtension("APP_MODE", "test");
 * }</pre>
 *
 * <p>The environment is restored after each test, whatever the test's outcome. See {@link
 * io.github.wphillipmoore.system.override.SystemEnvironment} for the override rules.
 */
public final class SystemEnvironmentExtension extends OverrideLifecycle
    implements BeforeEachCallback, AfterEachCallback {

  /** Overrides the given variables with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public SystemEnvironmentExtension(Map<String, ? extends @Nullable String> environment) {
    this(environment, SystemOverrideMode.ALLOW_OVERRIDE);
  }

  /** Overrides the given variables. */
  public SystemEnvironmentExtension(
      Map<String, ? extends @Nullable String> environment, SystemOverrideMode mode) {
    this(new ScopedOverride(new EnvironmentAccessor()), environment, mode);
  }

  /** Overrides the given variables with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public SystemEnvironmentExtension(
      List<? extends Map.Entry<String, ? extends @Nullable String>> environment) {
    this(entries(environment), SystemOverrideMode.ALLOW_OVERRIDE);
  }

  /** Overrides the given variables. Later entries win for duplicate names. */
  public SystemEnvironmentExtension(
      List<? extends Map.Entry<String, ? extends @Nullable String>> environment,
      SystemOverrideMode mode) {
    this(entries(environment), mode);
  }

  /** Overrides one variable with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public SystemEnvironmentExtension(String key, @Nullable String value) {
    this(single(key, value), SystemOverrideMode.ALLOW_OVERRIDE);
  }

  /** Overrides one variable. */
  public SystemEnvironmentExtension(String key, @Nullable String value, SystemOverrideMode mode) {
    this(single(key, value), mode);
  }

  /** Creates an extension over an injected override. Package-private for testing. */
  SystemEnvironmentExtension(
      ScopedOverride override,
      Map<String, ? extends @Nullable String> environment,
      SystemOverrideMode mode) {
    super(override, environment, mode);
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
