package io.github.wphillipmoore.system.override;

import io.github.wphillipmoore.system.override.exception.RestoreFailedException;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies an override to one system table and restores the table's snapshot afterwards.
 *
 * <p>{@link #run} is the block-scoped form. {@link #apply} and {@link #restore} split the same
 * steps across two calls for the lifecycle adapters in {@code
 * io.github.wphillipmoore.system.override.junit}.
 *
 * <p>Nesting is safe: an inner override restores the table the outer override left in place.
 * There is no locking. Overlapping overrides of one table from several threads race, and the
 * table may end up in neither original state.
 */
public final class ScopedOverride {

  private static final Logger LOG = LoggerFactory.getLogger(ScopedOverride.class);

  private final SystemStateAccessor accessor;

  /**
   * Creates a scoped override for the given table.
   *
   * @param accessor the table accessor, must not be null
   */
  public ScopedOverride(SystemStateAccessor accessor) {
    this.accessor = Objects.requireNonNull(accessor, "accessor");
  }

  /** Returns the accessor this override writes through. */
  public SystemStateAccessor getAccessor() {
    return accessor;
  }

  /**
   * Runs {@code block} with {@code desired} merged into the table.
   *
   * <p>If applying the override fails, the block is not run. The table is restored on every exit
   * path of the block. A failure from the block is rethrown unchanged after the restore; if the
   * restore itself fails, its {@link RestoreFailedException} (or an {@link Error} thrown while
   * restoring) is thrown instead with the block's failure added as suppressed.
   *
   * @param desired the desired entries, {@code null} values request removal
   * @param mode the merge strategy
   * @param block the work to run while the override is applied
   * @param <T> the result type
   * @param <E> the exception type of the block
   * @return the block's result
   * @throws E if the block fails
   * @throws io.github.wphillipmoore.system.override.exception.StateAccessDeniedException if the
   *     override cannot be applied
   * @throws RestoreFailedException if the table cannot be restored
   */
  public <T, E extends Throwable> T run(
      Map<String, ? extends @Nullable String> desired,
      SystemOverrideMode mode,
      OverrideBlock<T, E> block)
      throws E {
    Objects.requireNonNull(block, "block");
    Map<String, String> original = apply(desired, mode);
    T result;
    try {
      result = block.run();
    } catch (Throwable failure) {
      restoreAfter(original, failure);
      throw failure;
    }
    restore(original);
    return result;
  }

  /**
   * Snapshots the table and replaces it with {@code desired} merged in.
   *
   * @param desired the desired entries, {@code null} values request removal
   * @param mode the merge strategy
   * @return the snapshot taken before the override, to pass to {@link #restore}
   */
  public Map<String, String> apply(
      Map<String, ? extends @Nullable String> desired, SystemOverrideMode mode) {
    Objects.requireNonNull(desired, "desired");
    Objects.requireNonNull(mode, "mode");
    Map<String, String> original = accessor.snapshot();
    accessor.replace(OverrideMerger.compute(original, desired, mode));
    LOG.debug("Applied {} override of {} with keys {}", mode, accessor.name(), desired.keySet());
    return original;
  }

  /**
   * Replaces the table with a snapshot taken by {@link #apply}.
   *
   * @param original the snapshot to restore
   * @throws RestoreFailedException if the table cannot be replaced
   */
  public void restore(Map<String, String> original) {
    Objects.requireNonNull(original, "original");
    try {
      accessor.replace(original);
    } catch (RuntimeException e) {
      throw new RestoreFailedException(
          "Failed to restore " + accessor.name() + " after override", accessor.name(), e);
    }
    LOG.debug("Restored {}", accessor.name());
  }

  private void restoreAfter(Map<String, String> original, Throwable failure) {
    try {
      restore(original);
    } catch (Throwable e) {
      if (e != failure) {
        e.addSuppressed(failure);
      }
      throw e;
    }
  }
}
