package com.codeheadsystems.keychain.cursor;

import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.model.ItemClass;
import com.codeheadsystems.keychain.model.ItemQuery;
import com.codeheadsystems.keychain.model.KeychainItem;
import com.codeheadsystems.keychain.registry.Keychain;
import com.codeheadsystems.keychain.store.ItemCursor;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one query over an ordered list of stores, yielding matches store by store.
 * <p>
 * A store that fails to open a cursor or to advance is skipped. A call to {@link #next()} that
 * finds nothing throws the last failure it saw only if no store has ever succeeded on this
 * cursor; otherwise it reports exhaustion. Not thread safe.
 */
public class MultiStoreCursor {

  private static final Logger log = LoggerFactory.getLogger(MultiStoreCursor.class);

  /**
   * Record types an any-class query never yields.
   */
  private static final Set<ItemClass> SKIPPED_FOR_ANY_CLASS =
      EnumSet.of(ItemClass.DATABASE_BLOB, ItemClass.SYMMETRIC_KEY);

  private final List<Keychain> keychains;
  private final ItemQuery query;
  private int current;
  private ItemCursor storeCursor;
  private boolean allFailed = true;

  /**
   * Instantiates a new Multi store cursor.
   *
   * @param keychains the keychains, searched in order
   * @param query     the query
   */
  public MultiStoreCursor(final List<Keychain> keychains, final ItemQuery query) {
    this.keychains = List.copyOf(keychains);
    this.query = query;
  }

  /**
   * First match across the stores.
   *
   * @param keychains the keychains
   * @param query     the query
   * @return the found item
   */
  public static Optional<FoundItem> findFirst(final List<Keychain> keychains, final ItemQuery query) {
    return new MultiStoreCursor(keychains, query).next();
  }

  /**
   * Next match.
   *
   * @return the found item, or empty when every store is exhausted
   * @throws KeychainException the last store failure, when every store so far has failed
   */
  public Optional<FoundItem> next() {
    KeychainException lastFailure = null;
    while (current < keychains.size()) {
      Keychain keychain = keychains.get(current);
      Optional<KeychainItem> item;
      try {
        if (storeCursor == null) {
          storeCursor = keychain.query(query);
        }
        item = storeCursor.next();
        allFailed = false;
      } catch (KeychainException e) {
        log.debug("Skipping {}: {}", keychain.identifier(), e.getMessage());
        lastFailure = e;
        item = Optional.empty();
      }
      if (item.isEmpty()) {
        current++;
        storeCursor = null;
        continue;
      }
      if (query.itemClass() == null && SKIPPED_FOR_ANY_CLASS.contains(item.get().itemClass())) {
        continue;
      }
      return Optional.of(new FoundItem(keychain, item.get()));
    }
    if (allFailed && lastFailure != null) {
      throw lastFailure;
    }
    return Optional.empty();
  }

  /**
   * Feeds the remaining matches to the action.
   *
   * @param action the action
   */
  public void forEachRemaining(final Consumer<FoundItem> action) {
    for (Optional<FoundItem> found = next(); found.isPresent(); found = next()) {
      action.accept(found.get());
    }
  }
}
