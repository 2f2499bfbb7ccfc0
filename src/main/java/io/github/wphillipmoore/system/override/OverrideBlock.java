package io.github.wphillipmoore.system.override;

/**
 * Unit of work executed while an override is applied.
 *
 * <p>The checked exception type {@code E} is propagated unchanged by {@link ScopedOverride#run}.
 * Lambdas that throw nothing checked infer {@code E} as {@link RuntimeException}.
 *
 * @param <T> the result type
 * @param <E> the exception type the block may throw
 */
@FunctionalInterface
public interface OverrideBlock<T, E extends Throwable> {

  /**
   * Runs the block.
   *
   * @return the block's result, may be {@code null}
   * @throws E if the block fails
   */
  T run() throws E;
}
