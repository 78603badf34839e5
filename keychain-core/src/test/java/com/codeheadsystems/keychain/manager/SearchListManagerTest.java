package com.codeheadsystems.keychain.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.keychain.config.KeychainConfiguration;
import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.model.BatchResult;
import com.codeheadsystems.keychain.model.Domain;
import com.codeheadsystems.keychain.model.KeychainEvent;
import com.codeheadsystems.keychain.model.SearchListState;
import com.codeheadsystems.keychain.model.StoreIdentifier;
import com.codeheadsystems.keychain.registry.CacheState;
import com.codeheadsystems.keychain.registry.Keychain;
import com.codeheadsystems.keychain.registry.KeychainRegistry;
import com.codeheadsystems.keychain.store.InMemorySearchListStorage;
import com.codeheadsystems.keychain.store.InMemoryStoreBackend;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type Search list manager test.
 */
class SearchListManagerTest {

  private static final byte[] SECRET = "secret".getBytes();
  private static final StoreIdentifier U1 = StoreIdentifier.of("/kc/user/u1.keychain");
  private static final StoreIdentifier U2 = StoreIdentifier.of("/kc/user/u2.keychain");
  private static final StoreIdentifier C1 = StoreIdentifier.of("/kc/common/c1.keychain");
  private static final StoreIdentifier D1 = StoreIdentifier.of("/kc/dynamic/d1.keychain");

  private final List<KeychainEvent> events = new ArrayList<>();
  private KeychainConfiguration configuration;
  private InMemoryStoreBackend backend;
  private InMemorySearchListStorage storage;
  private KeychainRegistry registry;
  private SearchListManager manager;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    configuration = KeychainConfiguration.forTesting(Path.of("/kc"));
    backend = new InMemoryStoreBackend();
    storage = new InMemorySearchListStorage();
    registry = new KeychainRegistry(backend);
    manager = new SearchListManager(configuration, registry, storage, events::add);
    List.of(U1, U2, C1, D1).forEach(id -> backend.seed(id, SECRET));
    storage.save(Domain.COMMON, new SearchListState(List.of(C1), null, null));
  }

  // ── Search lists ────────────────────────────────────────────────────────

  /**
   * Effective list is dynamic, then saved, then common.
   */
  @Test
  void effectiveSearchList_dynamicSavedCommon() {
    storage.save(Domain.USER, new SearchListState(List.of(U1, U2), null, null));
    manager.setDynamicSearchList(List.of(D1));

    assertThat(identifiers(manager.effectiveSearchList())).containsExactly(D1, U1, U2, C1);
  }

  /**
   * A store listed in two lists appears once.
   */
  @Test
  void effectiveSearchList_sharedEntry_once() {
    storage.save(Domain.USER, new SearchListState(List.of(U1, C1), null, null));

    assertThat(identifiers(manager.effectiveSearchList())).containsExactly(U1, C1);
  }

  /**
   * Stores whose provider is unavailable are left out.
   */
  @Test
  void effectiveSearchList_unreachable_skipped() {
    storage.save(Domain.USER, new SearchListState(List.of(U1, U2), null, null));
    backend.markUnreachable(U1);

    assertThat(identifiers(manager.effectiveSearchList())).containsExactly(U2, C1);
  }

  /**
   * Another process's write is picked up.
   */
  @Test
  void effectiveSearchList_externalWrite_seen() {
    manager.effectiveSearchList();
    storage.save(Domain.USER, new SearchListState(List.of(U2), null, null));

    assertThat(identifiers(manager.effectiveSearchList())).containsExactly(U2, C1);
  }

  /**
   * Set search list drops a trailing copy of the common list.
   */
  @Test
  void setSearchList_trailingCommon_stripped() {
    manager.setSearchList(List.of(handle(U1), handle(U2), handle(C1)));

    assertThat(storage.load(Domain.USER).state().searchList()).containsExactly(U1, U2);
    assertThat(identifiers(manager.effectiveSearchList())).containsExactly(U1, U2, C1);
    assertThat(events).containsExactly(KeychainEvent.searchListChanged());
  }

  /**
   * Setting the same list again posts nothing.
   */
  @Test
  void setSearchList_unchanged_noEvent() {
    manager.setSearchList(List.of(handle(U1)));
    events.clear();

    manager.setSearchList(List.of(handle(U1)));

    assertThat(events).isEmpty();
  }

  /**
   * Other domains are written without an event.
   */
  @Test
  void setSearchList_otherDomain_noEvent() {
    manager.setSearchList(Domain.SYSTEM, List.of(handle(U1)));

    assertThat(storage.load(Domain.SYSTEM).state().searchList()).containsExactly(U1);
    assertThat(identifiers(manager.searchList(Domain.SYSTEM))).containsExactly(U1);
    assertThat(events).isEmpty();
  }

  /**
   * The dynamic list cannot be persisted.
   */
  @Test
  void setSearchList_dynamic_invalidDomain() {
    assertKind(() -> manager.setSearchList(Domain.DYNAMIC, List.of()), ErrorKind.INVALID_DOMAIN);
    assertKind(() -> manager.setDomain(Domain.DYNAMIC), ErrorKind.INVALID_DOMAIN);
  }

  /**
   * Switching domain retargets the saved list.
   */
  @Test
  void setDomain_retargetsSavedList() {
    storage.save(Domain.SYSTEM, new SearchListState(List.of(U2), null, null));

    manager.setDomain(Domain.SYSTEM);

    assertThat(manager.domain()).isEqualTo(Domain.SYSTEM);
    assertThat(identifiers(manager.effectiveSearchList())).containsExactly(U2, C1);
  }

  /**
   * Size and at cover the saved then common list.
   */
  @Test
  void sizeAndAt_savedThenCommon() {
    storage.save(Domain.USER, new SearchListState(List.of(U1), null, null));

    assertThat(manager.size()).isEqualTo(2);
    assertThat(manager.at(1).identifier()).isEqualTo(C1);
    assertKind(() -> manager.at(2), ErrorKind.INVALID_PARAMETER);
  }

  // ── Adding and creating ─────────────────────────────────────────────────

  /**
   * An existing store is appended once.
   */
  @Test
  void addStore_existing_appended() {
    Keychain keychain = manager.addStore(U1, false);
    manager.addStore(U1, false);

    assertThat(keychain.identifier()).isEqualTo(U1);
    assertThat(storage.load(Domain.USER).state().searchList()).containsExactly(U1);
    assertThat(events).containsExactly(KeychainEvent.searchListChanged());
  }

  /**
   * A store already in the common list is not added.
   */
  @Test
  void addStore_inCommon_notAdded() {
    manager.addStore(C1, false);

    assertThat(storage.load(Domain.USER).state().searchList()).isEmpty();
    assertThat(events).isEmpty();
  }

  /**
   * A missing store is never added.
   */
  @Test
  void addStore_missing() {
    StoreIdentifier missing = StoreIdentifier.of("/kc/user/missing.keychain");

    Keychain keychain = manager.addStore(missing, true);

    assertThat(keychain.exists()).isFalse();
    assertThat(storage.load(Domain.USER).state().searchList()).isEmpty();
    assertKind(() -> manager.addStore(missing, false), ErrorKind.STORE_DOES_NOT_EXIST);
  }

  /**
   * Make resolves relative names against the domain's keychain directory.
   */
  @Test
  void make_relative_resolvedAgainstUserDirectory() {
    Keychain keychain = manager.make("work.keychain", false);

    assertThat(keychain.identifier().name()).isEqualTo("/kc/user/work.keychain");
  }

  /**
   * A created store is listed and becomes default when there is none.
   */
  @Test
  void createKeychain_listedAndDefault() {
    StoreIdentifier id = StoreIdentifier.of("/kc/user/new.keychain");

    Keychain keychain = manager.createKeychain(id, SECRET);

    assertThat(keychain.exists()).isTrue();
    assertThat(manager.defaultKeychain()).isSameAs(keychain);
    assertThat(storage.load(Domain.USER).state().searchList()).containsExactly(id);
    assertThat(events).containsExactly(KeychainEvent.searchListChanged(), KeychainEvent.defaultChanged(id));
  }

  // ── Default ─────────────────────────────────────────────────────────────

  /**
   * An unset default is not found.
   */
  @Test
  void defaultKeychain_unset_notFound() {
    assertKind(() -> manager.defaultKeychain(), ErrorKind.NOT_FOUND);
  }

  /**
   * A default whose store is gone is not found.
   */
  @Test
  void defaultKeychain_deleted_notFound() {
    Keychain keychain = handle(U1);
    manager.setDefaultKeychain(keychain);
    keychain.delete();

    assertKind(() -> manager.defaultKeychain(), ErrorKind.NOT_FOUND);
  }

  /**
   * Default changed is posted only when the value changes.
   */
  @Test
  void setDefaultKeychain_postsOnlyOnChange() {
    manager.setDefaultKeychain(handle(U1));
    manager.setDefaultKeychain(handle(U1));

    assertThat(manager.defaultKeychain().identifier()).isEqualTo(U1);
    assertThat(events).containsExactly(KeychainEvent.defaultChanged(U1));
  }

  // ── Rename and remove ───────────────────────────────────────────────────

  /**
   * Rename rewrites the list entry, the default and the registry.
   */
  @Test
  void rename_rewritesEverything() {
    Keychain keychain = handle(U1);
    manager.setSearchList(List.of(keychain, handle(U2)));
    manager.setDefaultKeychain(keychain);
    events.clear();

    StoreIdentifier renamed = manager.rename(keychain, "renamed.keychain");

    assertThat(renamed.name()).isEqualTo("/kc/user/renamed.keychain");
    assertThat(storage.load(Domain.USER).state().searchList()).containsExactly(renamed, U2);
    assertThat(manager.defaultKeychain()).isSameAs(keychain);
    assertThat(registry.cached(renamed)).containsSame(keychain);
    assertThat(registry.cached(U1)).isEmpty();
    assertThat(events).containsExactly(KeychainEvent.searchListChanged(), KeychainEvent.defaultChanged(renamed));
  }

  /**
   * Rename unique skips taken names.
   */
  @Test
  void renameUnique_skipsTakenNames() {
    backend.seed(StoreIdentifier.of("/kc/user/old1.keychain"), SECRET);

    StoreIdentifier renamed = manager.renameUnique(handle(U1), "old");

    assertThat(renamed.name()).isEqualTo("/kc/user/old2.keychain");
  }

  /**
   * Remove with delete clears the default, evicts and deletes each store.
   */
  @Test
  void remove_withDelete_batch() {
    Keychain first = handle(U1);
    Keychain second = handle(U2);
    manager.setSearchList(List.of(first, second));
    manager.setDefaultKeychain(first);
    second.delete();
    events.clear();

    BatchResult<StoreIdentifier> result = manager.remove(List.of(first, second), true);

    assertThat(result.size()).isEqualTo(2);
    assertThat(result.results().get(0).succeeded()).isTrue();
    assertThat(result.firstFailure()).get()
        .satisfies(e -> assertThat(e.kind()).isEqualTo(ErrorKind.STORE_DOES_NOT_EXIST));
    assertThat(backend.contains(U1)).isFalse();
    assertThat(first.cacheState()).isEqualTo(CacheState.EVICTED);
    SearchListState state = storage.load(Domain.USER).state();
    assertThat(state.searchList()).isEmpty();
    assertThat(state.defaultKeychain()).isNull();
    assertThat(events).containsExactly(KeychainEvent.searchListChanged(), KeychainEvent.defaultChanged(null));
  }

  /**
   * Remove without delete keeps the backing store.
   */
  @Test
  void remove_withoutDelete_keepsBacking() {
    Keychain keychain = handle(U1);
    manager.setSearchList(List.of(keychain));

    BatchResult<StoreIdentifier> result = manager.remove(List.of(keychain), false);

    assertThat(result.allSucceeded()).isTrue();
    assertThat(backend.contains(U1)).isTrue();
    assertThat(keychain.cacheState()).isEqualTo(CacheState.CACHED);
  }

  // ── Domain lists ────────────────────────────────────────────────────────

  /**
   * Domain list membership can be added, tested and removed.
   */
  @Test
  void domainList_addTestRemove() {
    manager.addToDomainList(Domain.COMMON, U1);

    assertThat(manager.isInDomainList(Domain.COMMON, U1)).isTrue();
    assertKind(() -> manager.addToDomainList(Domain.COMMON, U1), ErrorKind.DUPLICATE_MEMBER);

    manager.removeFromDomainList(Domain.COMMON, U1);

    assertThat(manager.isInDomainList(Domain.COMMON, U1)).isFalse();
    assertKind(() -> manager.addToDomainList(Domain.DYNAMIC, U1), ErrorKind.INVALID_DOMAIN);
  }

  /**
   * Optional search list prefers the explicit list.
   */
  @Test
  void optionalSearchList_explicitWins() {
    assertThat(identifiers(manager.optionalSearchList(List.of(handle(U2))))).containsExactly(U2);
    assertThat(identifiers(manager.optionalSearchList(null))).containsExactly(C1);
  }

  private Keychain handle(final StoreIdentifier id) {
    return registry.resolve(id);
  }

  private static List<StoreIdentifier> identifiers(final List<Keychain> keychains) {
    return keychains.stream().map(Keychain::identifier).toList();
  }

  private static void assertKind(final Runnable action, final ErrorKind kind) {
    assertThatThrownBy(action::run)
        .isInstanceOf(KeychainException.class)
        .satisfies(e -> assertThat(((KeychainException) e).kind()).isEqualTo(kind));
  }
}
