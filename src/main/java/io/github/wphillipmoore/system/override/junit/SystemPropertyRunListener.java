package io.github.wphillipmoore.system.override.junit;

import io.github.wphillipmoore.system.override.OverrideMaps;
import io.github.wphillipmoore.system.override.ScopedOverride;
import io.github.wphillipmoore.system.override.SystemOverrideMode;
import io.github.wphillipmoore.system.override.SystemPropertiesAccessor;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.jspecify.annotations.Nullable;
import org.junit.platform.launcher.TestExecutionListener;
import org.junit.platform.launcher.TestPlan;

/**
 * Overrides system properties for a whole test run.
 *
 * <p>Registered the same way as {@link SystemEnvironmentRunListener}. The properties are restored
 * when the test plan finishes executing.
 */
public class SystemPropertyRunListener extends OverrideLifecycle implements TestExecutionListener {

  /** Overrides the given properties with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public SystemPropertyRunListener(Map<String, ? extends @Nullable String> properties) {
    this(properties, SystemOverrideMode.ALLOW_OVERRIDE);
  }

  /** Overrides the given properties. */
  public SystemPropertyRunListener(
      Map<String, ? extends @Nullable String> properties, SystemOverrideMode mode) {
    this(new ScopedOverride(new SystemPropertiesAccessor()), properties, mode);
  }

  /** Overrides the given properties with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public SystemPropertyRunListener(
      List<? extends Map.Entry<String, ? extends @Nullable String>> properties) {
    this(entries(properties), SystemOverrideMode.ALLOW_OVERRIDE);
  }

  /** Overrides the given properties. Later entries win for duplicate keys. */
  public SystemPropertyRunListener(
      List<? extends Map.Entry<String, ? extends @Nullable String>> properties,
      SystemOverrideMode mode) {
    this(entries(properties), mode);
  }

  /** Overrides one property with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public SystemPropertyRunListener(String key, @Nullable String value) {
    this(single(key, value), SystemOverrideMode.ALLOW_OVERRIDE);
  }

  /** Overrides one property. */
  public SystemPropertyRunListener(String key, @Nullable String value, SystemOverrideMode mode) {
    this(single(key, value), mode);
  }

  /** Overrides the given properties with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public SystemPropertyRunListener(Properties properties) {
    this(OverrideMaps.fromProperties(properties), SystemOverrideMode.ALLOW_OVERRIDE);
  }

  /** Overrides the given properties. */
  public SystemPropertyRunListener(Properties properties, SystemOverrideMode mode) {
    this(OverrideMaps.fromProperties(properties), mode);
  }

  /** Creates a listener over an injected override. Package-private for testing. */
  SystemPropertyRunListener(
      ScopedOverride override,
      Map<String, ? extends @Nullable String> properties,
      SystemOverrideMode mode) {
    super(override, properties, mode);
  }

  @Override
  public void testPlanExecutionStarted(TestPlan testPlan) {
    beforeScope();
  }

  @Override
  public void testPlanExecutionFinished(TestPlan testPlan) {
    afterScope();
  }
}
