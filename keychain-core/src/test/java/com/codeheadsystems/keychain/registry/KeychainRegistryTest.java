package com.codeheadsystems.keychain.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.model.StoreIdentifier;
import com.codeheadsystems.keychain.store.InMemoryStoreBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type Keychain registry test.
 */
class KeychainRegistryTest {

  private static final StoreIdentifier A = StoreIdentifier.of("/k/a.keychain");
  private static final StoreIdentifier B = StoreIdentifier.of("/k/b.keychain");
  private static final byte[] SECRET = "secret".getBytes();

  private InMemoryStoreBackend backend;
  private KeychainRegistry registry;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    backend = new InMemoryStoreBackend();
    registry = new KeychainRegistry(backend);
  }

  /**
   * Equal identifiers resolve to the same handle.
   */
  @Test
  void resolve_equalIdentifiers_sameHandle() {
    Keychain first = registry.resolve(A);
    Keychain second = registry.resolve(StoreIdentifier.of("/k/./a.keychain"));

    assertThat(second).isSameAs(first);
    assertThat(first.cacheState()).isEqualTo(CacheState.CACHED);
    assertThat(registry.size()).isEqualTo(1);
  }

  /**
   * Unavailable providers surface as backend unavailable.
   */
  @Test
  void resolve_unreachable_throws() {
    backend.markUnreachable(A);

    assertThatThrownBy(() -> registry.resolve(A))
        .isInstanceOf(KeychainException.class)
        .satisfies(e -> assertThat(((KeychainException) e).is(ErrorKind.BACKEND_UNAVAILABLE)).isTrue());
    assertThat(registry.cached(A)).isEmpty();
  }

  /**
   * Evict is idempotent.
   */
  @Test
  void evict_twice_secondIsNoOp() {
    Keychain keychain = registry.resolve(A);

    assertThat(registry.evict(A, keychain)).isTrue();
    assertThat(registry.evict(A, keychain)).isFalse();
    assertThat(keychain.cacheState()).isEqualTo(CacheState.EVICTED);
    assertThat(registry.cached(A)).isEmpty();
  }

  /**
   * Evicting a stale handle leaves the current mapping alone.
   */
  @Test
  void evict_staleHandle_keepsCurrentMapping() {
    Keychain stale = registry.resolve(A);
    registry.evict(A, stale);
    Keychain current = registry.resolve(A);

    assertThat(current).isNotSameAs(stale);
    assertThat(registry.evict(A, stale)).isFalse();
    assertThat(registry.cached(A)).containsSame(current);
  }

  /**
   * Evicting under an identifier the handle is not cached for changes nothing.
   */
  @Test
  void evict_wrongIdentifier_leavesHandleCached() {
    Keychain keychain = registry.resolve(A);

    assertThat(registry.evict(B, keychain)).isFalse();
    assertThat(keychain.cacheState()).isEqualTo(CacheState.CACHED);
    assertThat(registry.cached(A)).containsSame(keychain);

    assertThat(registry.evict(A, keychain)).isTrue();
    assertThat(keychain.cacheState()).isEqualTo(CacheState.EVICTED);
    assertThat(registry.resolve(A)).isNotSameAs(keychain);
  }

  /**
   * Externally removed stores are evicted.
   */
  @Test
  void notifyExternallyRemoved_evicts() {
    Keychain keychain = registry.resolve(A);

    assertThat(registry.notifyExternallyRemoved(A)).isTrue();
    assertThat(registry.notifyExternallyRemoved(A)).isFalse();
    assertThat(keychain.cacheState()).isEqualTo(CacheState.EVICTED);
  }

  /**
   * Rename moves the mapping and evicts a handle cached under the target.
   */
  @Test
  void rename_rekeysAndEvictsDisplaced() {
    backend.seed(A, SECRET);
    Keychain renamed = registry.resolve(A);
    Keychain displaced = registry.resolve(B);

    registry.rename(renamed, B);

    assertThat(renamed.identifier()).isEqualTo(B);
    assertThat(registry.cached(B)).containsSame(renamed);
    assertThat(registry.cached(A)).isEmpty();
    assertThat(displaced.cacheState()).isEqualTo(CacheState.EVICTED);
    assertThat(backend.contains(B)).isTrue();
    assertThat(backend.contains(A)).isFalse();
  }

  /**
   * An evicted handle is not reinserted by a rename.
   */
  @Test
  void rename_evictedHandle_notReinserted() {
    backend.seed(A, SECRET);
    Keychain keychain = registry.resolve(A);
    registry.evict(A, keychain);

    registry.rename(keychain, B);

    assertThat(registry.cached(B)).isEmpty();
    assertThat(keychain.cacheState()).isEqualTo(CacheState.EVICTED);
  }

  /**
   * Exists checks without caching.
   */
  @Test
  void exists_doesNotCache() {
    backend.seed(A, SECRET);

    assertThat(registry.exists(A)).isTrue();
    assertThat(registry.exists(B)).isFalse();
    assertThat(registry.size()).isZero();
  }
}
