package com.codeheadsystems.keychain.model;

import com.codeheadsystems.keychain.exceptions.KeychainException;
import java.util.List;
import java.util.Optional;

/**
 * Ordered per-item outcomes of a best-effort batch. One item failing never stops the others;
 * each operation documents which item is representative for its public result.
 *
 * @param results per-item results in submission order
 * @param <T>     the value type
 */
public record BatchResult<T>(List<ItemResult<T>> results) {

  public BatchResult {
    results = List.copyOf(results);
  }

  /**
   * All succeeded boolean.
   *
   * @return true if no item failed
   */
  public boolean allSucceeded() {
    return results.stream().allMatch(ItemResult::succeeded);
  }

  /**
   * The first failure in submission order.
   *
   * @return the failure, if any
   */
  public Optional<KeychainException> firstFailure() {
    return results.stream().map(ItemResult::failure).filter(f -> f != null).findFirst();
  }

  /**
   * Failed items.
   *
   * @return the failed results
   */
  public List<ItemResult<T>> failures() {
    return results.stream().filter(r -> !r.succeeded()).toList();
  }

  /**
   * Size int.
   *
   * @return the number of items
   */
  public int size() {
    return results.size();
  }
}
