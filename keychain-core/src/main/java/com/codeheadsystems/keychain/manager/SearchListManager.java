package com.codeheadsystems.keychain.manager;

import com.codeheadsystems.keychain.config.KeychainConfiguration;
import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.model.BatchResult;
import com.codeheadsystems.keychain.model.Domain;
import com.codeheadsystems.keychain.model.ItemResult;
import com.codeheadsystems.keychain.model.KeychainEvent;
import com.codeheadsystems.keychain.model.SearchListState;
import com.codeheadsystems.keychain.model.StoreIdentifier;
import com.codeheadsystems.keychain.notify.ChangeNotifier;
import com.codeheadsystems.keychain.registry.Keychain;
import com.codeheadsystems.keychain.registry.KeychainRegistry;
import com.codeheadsystems.keychain.store.SearchListStorage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the per-domain search lists and the default and login designations.
 * <p>
 * The effective search list is the dynamic list, then the current domain's saved list, then the
 * common list. Every read-modify-write of persisted state happens under the registry's API lock,
 * after a forced revert so that changes made by other processes are not lost. Change events are
 * posted after the lock is released.
 */
@Singleton
public class SearchListManager {

  private static final Logger log = LoggerFactory.getLogger(SearchListManager.class);

  private final KeychainConfiguration configuration;
  private final KeychainRegistry registry;
  private final SearchListStorage storage;
  private final ChangeNotifier notifier;
  private final ReentrantLock apiLock;
  private final PersistedSearchList savedList;
  private final PersistedSearchList commonList;
  private volatile List<StoreIdentifier> dynamicList = List.of();

  /**
   * Instantiates a new Search list manager.
   *
   * @param configuration the configuration
   * @param registry      the registry
   * @param storage       the storage
   * @param notifier      the notifier
   */
  @Inject
  public SearchListManager(final KeychainConfiguration configuration,
                           final KeychainRegistry registry,
                           final SearchListStorage storage,
                           final ChangeNotifier notifier) {
    this.configuration = configuration;
    this.registry = registry;
    this.storage = storage;
    this.notifier = notifier;
    this.apiLock = registry.apiLock();
    this.savedList = new PersistedSearchList(storage, configuration.initialDomain());
    this.commonList = new PersistedSearchList(storage, Domain.COMMON);
    log.info("SearchListManager({})", configuration.initialDomain());
  }

  // ── Domain ──────────────────────────────────────────────────────────────

  public Domain domain() {
    return withLock(savedList::domain);
  }

  /**
   * Selects which persisted list is the saved list.
   *
   * @param domain the domain
   */
  public void setDomain(final Domain domain) {
    requirePersisted(domain);
    apiLock.lock();
    try {
      if (savedList.domain() != domain) {
        log.debug("setDomain({})", domain);
        savedList.domain(domain);
      }
    } finally {
      apiLock.unlock();
    }
  }

  // ── Search lists ────────────────────────────────────────────────────────

  /**
   * The stores searched by default: dynamic, then saved, then common. A store whose provider is
   * unavailable is left out. A store listed twice appears once, at its first position.
   *
   * @return the keychains
   */
  public List<Keychain> effectiveSearchList() {
    List<StoreIdentifier> ids = withLock(() -> {
      savedList.revert(false);
      commonList.revert(false);
      Set<StoreIdentifier> ordered = new LinkedHashSet<>(dynamicList);
      ordered.addAll(savedList.state().searchList());
      ordered.addAll(commonList.state().searchList());
      return new ArrayList<>(ordered);
    });
    return resolveAvailable(ids);
  }

  /**
   * The search list of one domain.
   *
   * @param domain the domain
   * @return the keychains
   */
  public List<Keychain> searchList(final Domain domain) {
    if (domain == Domain.DYNAMIC) {
      return resolveAvailable(dynamicList);
    }
    return resolveAvailable(withLock(() -> listFor(domain, false).state().searchList()));
  }

  /**
   * Replaces the current domain's saved list.
   *
   * @param keychains the keychains
   */
  public void setSearchList(final List<Keychain> keychains) {
    setSearchList(domain(), keychains);
  }

  /**
   * Replaces a domain's saved list. For the current domain a trailing run equal to the whole
   * common list is dropped first, and an event is posted if the persisted list changed. Other
   * domains are written without an event.
   *
   * @param domain    the domain
   * @param keychains the keychains
   */
  public void setSearchList(final Domain domain, final List<Keychain> keychains) {
    requirePersisted(domain);
    List<StoreIdentifier> ids = keychains.stream().map(Keychain::identifier).toList();
    boolean changed = withLock(() -> {
      if (domain == savedList.domain()) {
        commonList.revert(false);
        List<StoreIdentifier> stripped = stripCommonSuffix(ids, commonList.state().searchList());
        savedList.revert(true);
        savedList.update(s -> s.withSearchList(stripped));
        return savedList.save();
      }
      PersistedSearchList other = listFor(domain, true);
      other.update(s -> s.withSearchList(ids));
      other.save();
      return false;
    });
    if (changed) {
      notifier.post(KeychainEvent.searchListChanged());
    }
  }

  /**
   * Replaces the in-memory dynamic list, searched ahead of everything else.
   *
   * @param ids the ids
   */
  public void setDynamicSearchList(final List<StoreIdentifier> ids) {
    dynamicList = List.copyOf(new LinkedHashSet<>(ids));
    notifier.post(KeychainEvent.searchListChanged());
  }

  /**
   * The explicit list if given and non-empty, otherwise the effective list.
   *
   * @param keychains the keychains, may be null
   * @return the keychains to search
   */
  public List<Keychain> optionalSearchList(final List<Keychain> keychains) {
    return keychains == null || keychains.isEmpty() ? effectiveSearchList() : List.copyOf(keychains);
  }

  /**
   * Number of stores in the saved list followed by the common list.
   *
   * @return the size
   */
  public int size() {
    return withLock(() -> savedThenCommon().size());
  }

  /**
   * Member of the saved list followed by the common list, by position.
   *
   * @param index the index
   * @return the keychain
   * @throws KeychainException INVALID_PARAMETER past the end
   */
  public Keychain at(final int index) {
    StoreIdentifier id = withLock(() -> {
      List<StoreIdentifier> list = savedThenCommon();
      if (index < 0 || index >= list.size()) {
        throw new KeychainException(ErrorKind.INVALID_PARAMETER, "No search list member at " + index);
      }
      return list.get(index);
    });
    return registry.resolve(id);
  }

  /**
   * Materializes a handle and, if the store exists and is in neither the saved nor the common
   * list, appends it to the saved list. A store that does not exist yet is never added; with
   * {@code makeIfAbsent} its handle is returned so it can be created, otherwise
   * STORE_DOES_NOT_EXIST is raised.
   *
   * @param id           the id
   * @param makeIfAbsent whether a handle for a missing store is acceptable
   * @return the keychain
   */
  public Keychain addStore(final StoreIdentifier id, final boolean makeIfAbsent) {
    Keychain keychain = registry.resolve(id);
    if (!keychain.exists()) {
      if (makeIfAbsent) {
        return keychain;
      }
      throw new KeychainException(ErrorKind.STORE_DOES_NOT_EXIST, "No such keychain: " + id.name());
    }
    boolean added = withLock(() -> {
      savedList.revert(true);
      commonList.revert(false);
      if (savedList.state().member(id) || commonList.state().member(id)) {
        return false;
      }
      savedList.update(s -> s.withAdded(id));
      return savedList.save();
    });
    if (added) {
      log.debug("addStore({})", id);
      notifier.post(KeychainEvent.searchListChanged());
    }
    return keychain;
  }

  /**
   * Handle for a path, resolved against the current domain's keychain directory when relative.
   *
   * @param pathName the path name
   * @param add      whether to add an existing store to the saved list
   * @return the keychain
   */
  public Keychain make(final String pathName, final boolean add) {
    Path path = Path.of(pathName);
    if (!path.isAbsolute()) {
      path = configuration.keychainDirectory(domain()).resolve(path);
    }
    StoreIdentifier id = configuration.identifierFor(path);
    return add ? addStore(id, true) : registry.resolve(id);
  }

  /**
   * Creates a new store, appends it to the saved list and makes it the default if there is none.
   *
   * @param id     the id
   * @param secret the secret
   * @return the keychain
   */
  public Keychain createKeychain(final StoreIdentifier id, final byte[] secret) {
    Keychain keychain = registry.resolve(id);
    keychain.create(secret);
    log.info("Created keychain {}", id);
    registerCreated(keychain);
    return keychain;
  }

  // ── Default and login designations ──────────────────────────────────────

  /**
   * The current domain's default store.
   *
   * @return the keychain
   * @throws KeychainException NOT_FOUND if none is designated or it no longer exists
   */
  public Keychain defaultKeychain() {
    return defaultKeychain(domain());
  }

  public Keychain defaultKeychain(final Domain domain) {
    requirePersisted(domain);
    StoreIdentifier id = withLock(() -> listFor(domain, false).state().defaultKeychain());
    return existing(id, "default");
  }

  /**
   * Designates the current domain's default store. Null clears the designation.
   *
   * @param keychain the keychain
   */
  public void setDefaultKeychain(final Keychain keychain) {
    setDefaultKeychain(domain(), keychain);
  }

  public void setDefaultKeychain(final Domain domain, final Keychain keychain) {
    requirePersisted(domain);
    StoreIdentifier id = keychain == null ? null : keychain.identifier();
    boolean changed = withLock(() -> {
      PersistedSearchList list = listFor(domain, true);
      list.update(s -> s.withDefaultKeychain(id));
      return list.save() && list == savedList;
    });
    if (changed) {
      notifier.post(KeychainEvent.defaultChanged(id));
    }
  }

  /**
   * The designated login store.
   *
   * @return the keychain
   * @throws KeychainException NOT_FOUND if none is designated or it no longer exists
   */
  public Keychain loginKeychain() {
    return existing(loginIdentifier(), "login");
  }

  public void setLoginKeychain(final Keychain keychain) {
    designateLogin(keychain == null ? null : keychain.identifier());
  }

  void designateLogin(final StoreIdentifier id) {
    withLock(() -> {
      savedList.revert(true);
      savedList.update(s -> s.withLoginKeychain(id));
      return savedList.save();
    });
  }

  // ── Rename and remove ───────────────────────────────────────────────────

  /**
   * Renames the backing store and rewrites every reference to it in the saved list and the
   * registry. A bare file name stays in the same directory.
   *
   * @param keychain the keychain
   * @param newName  the new name or path
   * @return the new identifier
   */
  public StoreIdentifier rename(final Keychain keychain, final String newName) {
    StoreIdentifier oldId = keychain.identifier();
    StoreIdentifier target = newName.contains("/") ? oldId.withName(newName) : oldId.sibling(newName);
    boolean wasDefault = withLock(() -> {
      savedList.revert(true);
      boolean isDefault = oldId.equals(savedList.state().defaultKeychain());
      registry.rename(keychain, target);
      savedList.update(s -> s.withRenamed(oldId, target));
      savedList.save();
      return isDefault;
    });
    log.info("Renamed keychain {} to {}", oldId, target);
    notifier.post(KeychainEvent.searchListChanged());
    if (wasDefault) {
      notifier.post(KeychainEvent.defaultChanged(target));
    }
    return target;
  }

  /**
   * Renames to the first free {@code <baseName><n>.keychain}, counting n from 1.
   *
   * @param keychain the keychain
   * @param baseName the base name or path
   * @return the new identifier
   */
  public StoreIdentifier renameUnique(final Keychain keychain, final String baseName) {
    for (int index = 1; index < Integer.MAX_VALUE; index++) {
      String candidate = baseName + index + KeychainConfiguration.KEYCHAIN_SUFFIX;
      StoreIdentifier id = candidate.contains("/")
          ? keychain.identifier().withName(candidate)
          : keychain.identifier().sibling(candidate);
      if (!registry.exists(id)) {
        return rename(keychain, candidate);
      }
    }
    throw new KeychainException(ErrorKind.DUPLICATE_MEMBER, "No free name for " + baseName);
  }

  /**
   * Removes stores from the saved list, clearing the default if it was among them. With
   * {@code deleteBacking} the handles are evicted and each backing store is deleted after the
   * lock is released; one failed deletion does not stop the others.
   *
   * @param keychains     the keychains
   * @param deleteBacking whether to delete the backing stores
   * @return one result per keychain
   */
  public BatchResult<StoreIdentifier> remove(final List<Keychain> keychains, final boolean deleteBacking) {
    boolean defaultCleared = withLock(() -> {
      savedList.revert(true);
      StoreIdentifier defaultId = savedList.state().defaultKeychain();
      boolean clearDefault = false;
      for (Keychain keychain : keychains) {
        StoreIdentifier id = keychain.identifier();
        savedList.update(s -> s.withRemoved(id));
        if (id.equals(defaultId)) {
          clearDefault = true;
        }
        if (deleteBacking) {
          registry.evict(id, keychain);
        }
      }
      if (clearDefault) {
        savedList.update(s -> s.withDefaultKeychain(null));
      }
      savedList.save();
      return clearDefault;
    });

    List<ItemResult<StoreIdentifier>> results = new ArrayList<>();
    for (Keychain keychain : keychains) {
      StoreIdentifier id = keychain.identifier();
      if (!deleteBacking) {
        results.add(ItemResult.success(id.toString(), id));
        continue;
      }
      try {
        keychain.delete();
        results.add(ItemResult.success(id.toString(), id));
      } catch (KeychainException e) {
        log.warn("Unable to delete keychain {}: {}", id, e.getMessage());
        results.add(ItemResult.failure(id.toString(), e));
      }
    }
    notifier.post(KeychainEvent.searchListChanged());
    if (defaultCleared) {
      notifier.post(KeychainEvent.defaultChanged(null));
    }
    return new BatchResult<>(results);
  }

  // ── Domain list membership ──────────────────────────────────────────────

  /**
   * Appends to a domain's saved list.
   *
   * @param domain the domain
   * @param id     the id
   * @throws KeychainException DUPLICATE_MEMBER if already present
   */
  public void addToDomainList(final Domain domain, final StoreIdentifier id) {
    requirePersisted(domain);
    boolean notify = withLock(() -> {
      PersistedSearchList list = listFor(domain, true);
      list.update(s -> s.withAdded(id));
      list.save();
      return list == savedList;
    });
    if (notify) {
      notifier.post(KeychainEvent.searchListChanged());
    }
  }

  public boolean isInDomainList(final Domain domain, final StoreIdentifier id) {
    if (domain == Domain.DYNAMIC) {
      return dynamicList.contains(id);
    }
    return withLock(() -> listFor(domain, false).state().member(id));
  }

  public void removeFromDomainList(final Domain domain, final StoreIdentifier id) {
    requirePersisted(domain);
    boolean changed = withLock(() -> {
      PersistedSearchList list = listFor(domain, true);
      list.update(s -> s.withRemoved(id));
      return list.save() && list == savedList;
    });
    if (changed) {
      notifier.post(KeychainEvent.searchListChanged());
    }
  }

  // ── Login support ───────────────────────────────────────────────────────

  /**
   * Login designation after a forced reload, falling back to the configured login path and
   * recording it when nothing is designated yet.
   */
  StoreIdentifier loginIdentifier() {
    return withLock(() -> {
      savedList.revert(true);
      StoreIdentifier id = savedList.state().loginKeychain();
      if (id == null && savedList.domain() == Domain.USER) {
        StoreIdentifier configured = configuration.loginKeychainIdentifier();
        savedList.update(s -> s.withLoginKeychain(configured));
        savedList.save();
        return configured;
      }
      return id;
    });
  }

  /**
   * Moves the short-name store onto the login path and rewrites its saved-list entry.
   */
  Keychain adopt(final StoreIdentifier from, final StoreIdentifier to) {
    Keychain keychain = registry.resolve(from);
    withLock(() -> {
      savedList.revert(true);
      registry.rename(keychain, to);
      savedList.update(s -> s.withRenamed(from, to));
      return savedList.save();
    });
    log.info("Adopted {} as login keychain {}", from, to);
    notifier.post(KeychainEvent.searchListChanged());
    return keychain;
  }

  Optional<StoreIdentifier> defaultIdentifier() {
    return Optional.ofNullable(withLock(() -> {
      savedList.revert(false);
      return savedList.state().defaultKeychain();
    }));
  }

  void registerCreated(final Keychain keychain) {
    StoreIdentifier id = keychain.identifier();
    boolean becameDefault = withLock(() -> {
      savedList.revert(true);
      boolean noDefault = savedList.state().defaultKeychain() == null;
      if (noDefault) {
        savedList.update(s -> s.withDefaultKeychain(id));
      }
      if (!savedList.state().member(id)) {
        savedList.update(s -> s.withAdded(id));
      }
      savedList.save();
      return noDefault;
    });
    notifier.post(KeychainEvent.searchListChanged());
    if (becameDefault) {
      notifier.post(KeychainEvent.defaultChanged(id));
    }
  }

  // ── Internals ───────────────────────────────────────────────────────────

  /**
   * Drops the trailing elements of {@code ids} when they equal the whole common list.
   */
  static List<StoreIdentifier> stripCommonSuffix(final List<StoreIdentifier> ids,
                                                 final List<StoreIdentifier> common) {
    if (common.isEmpty() || common.size() > ids.size()) {
      return ids;
    }
    int start = ids.size() - common.size();
    if (ids.subList(start, ids.size()).equals(common)) {
      return List.copyOf(ids.subList(0, start));
    }
    return ids;
  }

  private List<StoreIdentifier> savedThenCommon() {
    savedList.revert(false);
    commonList.revert(false);
    Set<StoreIdentifier> ordered = new LinkedHashSet<>(savedList.state().searchList());
    ordered.addAll(commonList.state().searchList());
    return new ArrayList<>(ordered);
  }

  private PersistedSearchList listFor(final Domain domain, final boolean force) {
    PersistedSearchList list;
    if (domain == savedList.domain()) {
      list = savedList;
    } else if (domain == Domain.COMMON) {
      list = commonList;
    } else {
      list = new PersistedSearchList(storage, domain);
    }
    list.revert(force);
    return list;
  }

  private Keychain existing(final StoreIdentifier id, final String what) {
    if (id == null) {
      throw new KeychainException(ErrorKind.NOT_FOUND, "No " + what + " keychain designated");
    }
    Keychain keychain;
    try {
      keychain = registry.resolve(id);
    } catch (KeychainException e) {
      throw new KeychainException(ErrorKind.NOT_FOUND, "The " + what + " keychain is unavailable: " + id, e);
    }
    if (!keychain.exists()) {
      throw new KeychainException(ErrorKind.NOT_FOUND, "The " + what + " keychain no longer exists: " + id);
    }
    return keychain;
  }

  private List<Keychain> resolveAvailable(final List<StoreIdentifier> ids) {
    List<Keychain> keychains = new ArrayList<>(ids.size());
    for (StoreIdentifier id : ids) {
      try {
        keychains.add(registry.resolve(id));
      } catch (KeychainException e) {
        if (!e.is(ErrorKind.BACKEND_UNAVAILABLE)) {
          throw e;
        }
        log.warn("Leaving {} out of the search list: {}", id, e.getMessage());
      }
    }
    return keychains;
  }

  private static void requirePersisted(final Domain domain) {
    if (!domain.isPersisted()) {
      throw new KeychainException(ErrorKind.INVALID_DOMAIN, "Domain " + domain + " cannot be used here");
    }
  }

  private <T> T withLock(final Supplier<T> action) {
    apiLock.lock();
    try {
      return action.get();
    } finally {
      apiLock.unlock();
    }
  }
}
