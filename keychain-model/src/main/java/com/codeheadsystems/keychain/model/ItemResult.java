package com.codeheadsystems.keychain.model;

import com.codeheadsystems.keychain.exceptions.KeychainException;
import java.util.Optional;

/**
 * Outcome of one item of a best-effort batch.
 *
 * @param key     what the item was, for logs and assertions
 * @param value   the produced value, null on failure
 * @param failure the failure, null on success
 * @param <T>     the value type
 */
public record ItemResult<T>(String key, T value, KeychainException failure) {

  /**
   * Success item result.
   *
   * @param <T>   the type parameter
   * @param key   the key
   * @param value the value
   * @return the item result
   */
  public static <T> ItemResult<T> success(final String key, final T value) {
    return new ItemResult<>(key, value, null);
  }

  /**
   * Failure item result.
   *
   * @param <T>     the type parameter
   * @param key     the key
   * @param failure the failure
   * @return the item result
   */
  public static <T> ItemResult<T> failure(final String key, final KeychainException failure) {
    return new ItemResult<>(key, null, failure);
  }

  /**
   * Succeeded boolean.
   *
   * @return true if the item succeeded
   */
  public boolean succeeded() {
    return failure == null;
  }

  /**
   * Failure as an optional.
   *
   * @return the failure, if any
   */
  public Optional<KeychainException> error() {
    return Optional.ofNullable(failure);
  }
}
