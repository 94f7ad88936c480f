package com.onthegomap.tiledmap.util;

import static com.onthegomap.tiledmap.util.Exceptions.throwFatalException;

import com.onthegomap.tiledmap.TmxException;
import java.util.Optional;

/**
 * A container for the result of an operation that may succeed or fail.
 * <p>
 * Decoders return this instead of throwing so callers can decide per element whether a failure aborts the whole
 * parse or only skips the element.
 *
 * @param <T> Type of the result value, if success
 */
public interface Try<T> {
  /**
   * Calls {@code supplier} and wraps the result in {@link Success} if successful, or {@link Failure} if it throws an
   * exception.
   */
  static <T> Try<T> apply(SupplierThatThrows<T> supplier) {
    try {
      return success(supplier.get());
    } catch (Exception e) {
      return failure(e);
    }
  }

  static <T> Success<T> success(T item) {
    return new Success<>(item);
  }

  static <T> Failure<T> failure(Exception throwable) {
    return new Failure<>(throwable);
  }

  /**
   * Returns the result if success, or throws an exception if failure.
   *
   * @throws Exceptions.FatalTiledMapException wrapping a checked exception on failure
   */
  T get();

  default boolean isSuccess() {
    return !isFailure();
  }

  default boolean isFailure() {
    return exception() != null;
  }

  default Exception exception() {
    return null;
  }

  /** Returns the {@link TmxException.Kind} of a failure caused by a {@link TmxException}. */
  default Optional<TmxException.Kind> errorKind() {
    return exception() instanceof TmxException e ? Optional.of(e.kind()) : Optional.empty();
  }

  /**
   * Returns the result if success, or re-throws the original {@link TmxException} if that is what caused the failure.
   */
  default T getOrThrow() throws TmxException {
    if (exception() instanceof TmxException e) {
      throw e;
    }
    return get();
  }

  /**
   * If this is a success, then maps the value through {@code fn}, returning the new value in a {@link Success} if
   * successful, or {@link Failure} if the mapping function threw an exception.
   */
  <O> Try<O> map(FunctionThatThrows<T, O> fn);

  record Success<T>(T get) implements Try<T> {

    @Override
    public <O> Try<O> map(FunctionThatThrows<T, O> fn) {
      return Try.apply(() -> fn.apply(get));
    }
  }
  record Failure<T>(@Override Exception exception) implements Try<T> {

    @Override
    public T get() {
      return throwFatalException(exception);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <O> Try<O> map(FunctionThatThrows<T, O> fn) {
      return (Try<O>) this;
    }
  }

  @FunctionalInterface
  interface SupplierThatThrows<T> {
    @SuppressWarnings("java:S112")
    T get() throws Exception;
  }
}
