package io.github.wphillipmoore.system.override;

import static io.github.wphillipmoore.system.override.SystemEnvironment.withEnvironment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SystemEnvironmentTest {

  private static final String KEY = "SYSTEM_OVERRIDE_TEST_FOO";
  private static final String OTHER = "SYSTEM_OVERRIDE_TEST_BAR";

  /** Runs the block through every single-variable overload and collects the results. */
  private static List<String> onAllOverloads(
      String key, @Nullable String value, SystemOverrideMode mode, Supplier<String> block) {
    List<String> results = new ArrayList<>();
    if (mode == SystemOverrideMode.ALLOW_OVERRIDE) {
      results.add(withEnvironment(key, value, block::get));
      results.add(withEnvironment(OverrideMaps.entry(key, value), block::get));
      results.add(withEnvironment(OverrideMaps.of(key, value), block::get));
    }
    results.add(withEnvironment(key, value, mode, block::get));
    results.add(withEnvironment(OverrideMaps.entry(key, value), mode, block::get));
    results.add(withEnvironment(OverrideMaps.of(key, value), mode, block::get));
    return results;
  }

  @Nested
  class CustomValue {

    @Test
    void variableIsVisibleInsideBlock() {
      List<String> results =
          onAllOverloads(
              KEY,
              "bar",
              SystemOverrideMode.ALLOW_OVERRIDE,
              () -> {
                assertThat(System.getenv(KEY)).isEqualTo("bar");
                return "RETURNED";
              });

      assertThat(results).hasSize(6).containsOnly("RETURNED");
    }

    @Test
    void variableIsGoneAfterBlock() {
      assertThat(System.getenv(KEY)).isNull();

      withEnvironment(KEY, "bar", () -> "RETURNED");

      assertThat(System.getenv(KEY)).isNull();
    }
  }

  @Nested
  class ExistingValue {

    @Test
    void nullValueRemovesVariable() {
      assertThat(System.getenv(KEY)).isNull();

      withEnvironment(
          KEY,
          "booz",
          () -> {
            List<String> results =
                onAllOverloads(
                    KEY,
                    null,
                    SystemOverrideMode.ALLOW_OVERRIDE,
                    () -> {
                      assertThat(System.getenv(KEY)).isNull();
                      return "RETURNED";
                    });
            assertThat(results).containsOnly("RETURNED");
            assertThat(System.getenv(KEY)).isEqualTo("booz");
            return null;
          });
    }

    @Test
    void denyOverrideKeepsExistingValue() {
      assertThat(System.getenv(KEY)).isNull();

      withEnvironment(
          KEY,
          "booz",
          () -> {
            List<String> results =
                onAllOverloads(
                    KEY,
                    "bar",
                    SystemOverrideMode.DENY_OVERRIDE,
                    () -> {
                      assertThat(System.getenv(KEY)).isEqualTo("booz");
                      return "RETURNED";
                    });
            assertThat(results).hasSize(3).containsOnly("RETURNED");
            return null;
          });
    }

    @Test
    void allowOverrideReplacesExistingValue() {
      withEnvironment(
          KEY,
          "booz",
          () -> {
            List<String> results =
                onAllOverloads(
                    KEY,
                    "bar",
                    SystemOverrideMode.ALLOW_OVERRIDE,
                    () -> {
                      assertThat(System.getenv(KEY)).isEqualTo("bar");
                      return "RETURNED";
                    });
            assertThat(results).containsOnly("RETURNED");
            return null;
          });
    }
  }

  @Test
  void severalVariablesAreAppliedTogether() {
    withEnvironment(
        Map.of(KEY, "1", OTHER, "2"),
        () -> {
          assertThat(System.getenv()).containsEntry(KEY, "1").containsEntry(OTHER, "2");
          return null;
        });

    assertThat(System.getenv()).doesNotContainKeys(KEY, OTHER);
  }

  @Test
  void unrelatedVariablesAreKept() {
    Map<String, String> before = Map.copyOf(System.getenv());

    Map<String, String> inside = withEnvironment(KEY, "1", () -> Map.copyOf(System.getenv()));

    assertThat(inside).containsAllEntriesOf(before);
    assertThat(System.getenv()).isEqualTo(before);
  }

  @Test
  void environmentIsRestoredWhenBlockThrows() {
    Map<String, String> before = Map.copyOf(System.getenv());

    assertThatThrownBy(
            () ->
                withEnvironment(
                    KEY,
                    "1",
                    () -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("boom");
    assertThat(System.getenv()).isEqualTo(before);
  }

  @Test
  void nestedOverridesRestoreOuterState() {
    withEnvironment(
        KEY,
        "outer",
        () -> {
          withEnvironment(
              OTHER,
              "inner",
              () -> {
                assertThat(System.getenv(KEY)).isEqualTo("outer");
                assertThat(System.getenv(OTHER)).isEqualTo("inner");
                return null;
              });
          assertThat(System.getenv(KEY)).isEqualTo("outer");
          assertThat(System.getenv(OTHER)).isNull();
          return null;
        });

    assertThat(System.getenv(KEY)).isNull();
  }
}
