package io.github.wphillipmoore.system.override.junit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.wphillipmoore.system.override.InMemoryStateAccessor;
import io.github.wphillipmoore.system.override.OverrideMaps;
import io.github.wphillipmoore.system.override.ScopedOverride;
import io.github.wphillipmoore.system.override.SystemOverrideMode;
import io.github.wphillipmoore.system.override.SystemStateAccessor;
import io.github.wphillipmoore.system.override.exception.StateAccessDeniedException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.platform.launcher.TestPlan;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SystemEnvironmentRunListenerTest {

  private static final String KEY = "SYSTEM_OVERRIDE_RUN_LISTENER_TEST";

  @Mock private TestPlan testPlan;
  @Mock private SystemStateAccessor deniedAccessor;

  @Test
  void overrideSpansTestPlanExecution() {
    InMemoryStateAccessor accessor = new InMemoryStateAccessor(Map.of("A", "1"));
    SystemEnvironmentRunListener listener =
        new SystemEnvironmentRunListener(
            new ScopedOverride(accessor),
            OverrideMaps.fromEntries(List.of(OverrideMaps.entry("A", null))),
            SystemOverrideMode.ALLOW_OVERRIDE);

    listener.testPlanExecutionStarted(testPlan);
    assertThat(accessor.live()).isEmpty();

    listener.testPlanExecutionFinished(testPlan);
    assertThat(accessor.live()).isEqualTo(Map.of("A", "1"));
  }

  @Test
  void deniedStartIsPropagatedAndFinishRestoresNothing() {
    StateAccessDeniedException denied =
        new StateAccessDeniedException("denied", "environment", new SecurityException("no"));
    when(deniedAccessor.snapshot()).thenReturn(Map.of("A", "1"));
    when(deniedAccessor.name()).thenReturn("environment");
    doThrow(denied).when(deniedAccessor).replace(anyMap());
    SystemEnvironmentRunListener listener =
        new SystemEnvironmentRunListener(
            new ScopedOverride(deniedAccessor),
            Map.of(KEY, "1"),
            SystemOverrideMode.ALLOW_OVERRIDE);

    assertThatThrownBy(() -> listener.testPlanExecutionStarted(testPlan)).isSameAs(denied);
    listener.testPlanExecutionFinished(testPlan);

    assertThat(listener.isApplied()).isFalse();
    verify(deniedAccessor).replace(anyMap());
    verify(deniedAccessor, never()).replace(Map.of("A", "1"));
  }

  @Test
  void realEnvironmentIsOverriddenForTheRun() {
    SystemEnvironmentRunListener listener = new SystemEnvironmentRunListener(KEY, "run");

    listener.testPlanExecutionStarted(testPlan);
    assertThat(System.getenv(KEY)).isEqualTo("run");

    listener.testPlanExecutionFinished(testPlan);
    assertThat(System.getenv(KEY)).isNull();
  }

  @Test
  void noArgSubclassCanBeRegisteredAsService() {
    SystemEnvironmentRunListener listener = new TestEnvironment();

    assertThat(listener.getDesired()).containsExactly(Map.entry(KEY, "service"));
  }

  /** Shape of a listener registered through {@code META-INF/services}. */
  static final class TestEnvironment extends SystemEnvironmentRunListener {
    TestEnvironment() {
      super(KEY, "service");
    }
  }
}
