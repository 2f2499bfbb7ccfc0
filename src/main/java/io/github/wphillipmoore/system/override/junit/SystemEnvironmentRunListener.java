package io.github.wphillipmoore.system.override.junit;

import io.github.wphillipmoore.system.override.EnvironmentAccessor;
import io.github.wphillipmoore.system.override.ScopedOverride;
import io.github.wphillipmoore.system.override.SystemOverrideMode;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.junit.platform.launcher.TestExecutionListener;
import org.junit.platform.launcher.TestPlan;

/**
 * Overrides environment variables for a whole test run.
 *
 * <p>The override is applied when the test plan starts executing and restored when it finishes,
 * so it spans every test in the run. Register an instance with {@code
 * Launcher#registerTestExecutionListeners}, or subclass it with a no-arg constructor and list the
 * subclass in {@code META-INF/services/org.junit.platform.launcher.TestExecutionListener}:
 *
 * <pre>{@code
 * public class TestEnvironment extends SystemEnvironmentRunListener {
 *   public TestEnvironment() {
 *     super("APP_MODE", "test");
 *   }
 * }
 * }</pre>
 */
public class SystemEnvironmentRunListener extends OverrideLifecycle
    implements TestExecutionListener {

  /** Overrides the given variables with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public SystemEnvironmentRunListener(Map<String, ? extends @Nullable String> environment) {
    this(environment, SystemOverrideMode.ALLOW_OVERRIDE);
  }

  /** Overrides the given variables. */
  public SystemEnvironmentRunListener(
      Map<String, ? extends @Nullable String> environment, SystemOverrideMode mode) {
    this(new ScopedOverride(new EnvironmentAccessor()), environment, mode);
  }

  /** Overrides the given variables with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public SystemEnvironmentRunListener(
      List<? extends Map.Entry<String, ? extends @Nullable String>> environment) {
    this(entries(environment), SystemOverrideMode.ALLOW_OVERRIDE);
  }

  /** Overrides the given variables. Later entries win for duplicate names. */
  public SystemEnvironmentRunListener(
      List<? extends Map.Entry<String, ? extends @Nullable String>> environment,
      SystemOverrideMode mode) {
    this(entries(environment), mode);
  }

  /** Overrides one variable with {@link SystemOverrideMode#ALLOW_OVERRIDE}. */
  public SystemEnvironmentRunListener(String key, @Nullable String value) {
    this(single(key, value), SystemOverrideMode.ALLOW_OVERRIDE);
  }

  /** Overrides one variable. */
  public SystemEnvironmentRunListener(
      String key, @Nullable String value, SystemOverrideMode mode) {
    this(single(key, value), mode);
  }

  /** Creates a listener over an injected override. Package-private for testing. */
  SystemEnvironmentRunListener(
      ScopedOverride override,
      Map<String, ? extends @Nullable String> environment,
      SystemOverrideMode mode) {
    super(override, environment, mode);
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
