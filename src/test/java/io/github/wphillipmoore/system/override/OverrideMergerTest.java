package io.github.wphillipmoore.system.override;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OverrideMergerTest {

  private static Map<String, @Nullable String> desired(Object... keysAndValues) {
    Map<String, @Nullable String> map = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      map.put((String) keysAndValues[i], (String) keysAndValues[i + 1]);
    }
    return map;
  }

  @Nested
  class AllowOverride {

    @Test
    void overridesExistingAndIgnoresRemovalOfMissingKey() {
      Map<String, String> merged =
          OverrideMerger.compute(
              Map.of("A", "1", "B", "2"),
              desired("A", "9", "C", null),
              SystemOverrideMode.ALLOW_OVERRIDE);

      assertThat(merged).containsExactlyInAnyOrderEntriesOf(Map.of("A", "9", "B", "2"));
    }

    @Test
    void nullValueRemovesExistingKey() {
      Map<String, String> merged =
          OverrideMerger.compute(
              Map.of("A", "1", "B", "2"), desired("A", null), SystemOverrideMode.ALLOW_OVERRIDE);

      assertThat(merged).containsExactly(Map.entry("B", "2"));
    }

    @Test
    void addsNewKeys() {
      Map<String, String> merged =
          OverrideMerger.compute(
              Map.of("A", "1"), desired("D", "5"), SystemOverrideMode.ALLOW_OVERRIDE);

      assertThat(merged).containsExactlyInAnyOrderEntriesOf(Map.of("A", "1", "D", "5"));
    }

    @Test
    void emptyDesiredReturnsOriginalContent() {
      Map<String, String> merged =
          OverrideMerger.compute(Map.of("A", "1"), Map.of(), SystemOverrideMode.ALLOW_OVERRIDE);

      assertThat(merged).isEqualTo(Map.of("A", "1"));
    }
  }

  @Nested
  class DenyOverride {

    @Test
    void keepsExistingAndAddsNewKeys() {
      Map<String, String> merged =
          OverrideMerger.compute(
              Map.of("A", "1"), desired("A", "9", "D", "5"), SystemOverrideMode.DENY_OVERRIDE);

      assertThat(merged).containsExactlyInAnyOrderEntriesOf(Map.of("A", "1", "D", "5"));
    }

    @Test
    void ignoresRemovalRequests() {
      Map<String, String> merged =
          OverrideMerger.compute(
              Map.of("A", "1"), desired("A", null, "C", null), SystemOverrideMode.DENY_OVERRIDE);

      assertThat(merged).isEqualTo(Map.of("A", "1"));
    }
  }

  @Test
  void newKeysAreAppendedAfterOriginalOrder() {
    Map<String, String> original = new LinkedHashMap<>();
    original.put("B", "2");
    original.put("A", "1");

    Map<String, String> merged =
        OverrideMerger.compute(original, desired("C", "3"), SystemOverrideMode.ALLOW_OVERRIDE);

    assertThat(merged.keySet()).containsExactly("B", "A", "C");
  }

  @Test
  void inputsAreNotModified() {
    Map<String, String> original = new LinkedHashMap<>(Map.of("A", "1"));
    Map<String, @Nullable String> wanted = desired("A", null, "B", "2");

    OverrideMerger.compute(original, wanted, SystemOverrideMode.ALLOW_OVERRIDE);

    assertThat(original).isEqualTo(Map.of("A", "1"));
    assertThat(wanted).containsEntry("A", null).containsEntry("B", "2");
  }

  @Test
  void resultIsUnmodifiable() {
    Map<String, String> merged =
        OverrideMerger.compute(Map.of(), desired("A", "1"), SystemOverrideMode.ALLOW_OVERRIDE);

    assertThatThrownBy(() -> merged.put("B", "2"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void nullModeThrowsNullPointerException() {
    assertThatThrownBy(() -> OverrideMerger.compute(Map.of(), Map.of(), null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("mode");
  }

  @Test
  void nullOriginalThrowsNullPointerException() {
    assertThatThrownBy(
            () -> OverrideMerger.compute(null, Map.of(), SystemOverrideMode.ALLOW_OVERRIDE))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("original");
  }
}
