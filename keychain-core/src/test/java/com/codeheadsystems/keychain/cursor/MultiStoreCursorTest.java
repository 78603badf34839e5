package com.codeheadsystems.keychain.cursor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.model.AttributeValue;
import com.codeheadsystems.keychain.model.ItemAttribute;
import com.codeheadsystems.keychain.model.ItemClass;
import com.codeheadsystems.keychain.model.ItemQuery;
import com.codeheadsystems.keychain.model.KeychainItem;
import com.codeheadsystems.keychain.model.StoreIdentifier;
import com.codeheadsystems.keychain.registry.Keychain;
import com.codeheadsystems.keychain.registry.KeychainRegistry;
import com.codeheadsystems.keychain.store.InMemoryStoreBackend;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type Multi store cursor test.
 */
class MultiStoreCursorTest {

  private static final byte[] SECRET = "secret".getBytes();
  private static final ItemQuery QUERY = ItemQuery.forClass(ItemClass.GENERIC_PASSWORD)
      .where(ItemAttribute.SERVICE, AttributeValue.of("svc"));

  private InMemoryStoreBackend backend;
  private KeychainRegistry registry;
  private Keychain first;
  private Keychain second;
  private Keychain third;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    backend = new InMemoryStoreBackend();
    registry = new KeychainRegistry(backend);
    first = create("/k/first.keychain");
    second = create("/k/second.keychain");
    third = create("/k/third.keychain");
  }

  /**
   * A failing store is skipped when a later store has the match.
   */
  @Test
  void next_firstFailsSecondEmptyThirdMatches_returnsMatch() {
    backend.failQueries(first.identifier(), ErrorKind.AUTH_FAILURE);
    KeychainItem stored = third.add(item("svc"));

    FoundItem found = new MultiStoreCursor(List.of(first, second, third), QUERY).next().orElseThrow();

    assertThat(found.keychain()).isSameAs(third);
    assertThat(found.item()).isEqualTo(stored);
  }

  /**
   * When every store fails the failure is raised.
   */
  @Test
  void next_allFail_throwsFailure() {
    List<Keychain> keychains = List.of(first, second, third);
    keychains.forEach(k -> backend.failQueries(k.identifier(), ErrorKind.AUTH_FAILURE));

    assertThatThrownBy(() -> new MultiStoreCursor(keychains, QUERY).next())
        .isInstanceOf(KeychainException.class)
        .satisfies(e -> assertThat(((KeychainException) e).kind()).isEqualTo(ErrorKind.AUTH_FAILURE));
  }

  /**
   * One working store turns failures into plain exhaustion.
   */
  @Test
  void next_someFailNoneMatch_returnsEmpty() {
    backend.failQueries(first.identifier(), ErrorKind.AUTH_FAILURE);

    assertThat(new MultiStoreCursor(List.of(first, second), QUERY).next()).isEmpty();
  }

  /**
   * A missing store counts as a failed store.
   */
  @Test
  void next_missingStore_skipped() {
    Keychain missing = registry.resolve(StoreIdentifier.of("/k/missing.keychain"));
    second.add(item("svc"));

    assertThat(new MultiStoreCursor(List.of(missing, second), QUERY).next())
        .map(FoundItem::keychain)
        .containsSame(second);
  }

  /**
   * Matches come store by store in search order.
   */
  @Test
  void forEachRemaining_searchOrder() {
    third.add(item("svc"));
    first.add(item("svc"));
    first.add(item("other"));
    second.add(item("svc"));
    List<Keychain> seen = new ArrayList<>();

    new MultiStoreCursor(List.of(first, second, third), QUERY).forEachRemaining(f -> seen.add(f.keychain()));

    assertThat(seen).containsExactly(first, second, third);
  }

  /**
   * Any-class queries skip blobs and symmetric keys.
   */
  @Test
  void next_anyClass_skipsBlobsAndSymmetricKeys() {
    first.add(KeychainItem.newItem(ItemClass.DATABASE_BLOB));
    first.add(KeychainItem.newItem(ItemClass.SYMMETRIC_KEY));
    KeychainItem password = first.add(item("svc"));
    List<KeychainItem> seen = new ArrayList<>();

    new MultiStoreCursor(List.of(first), ItemQuery.anyClass()).forEachRemaining(f -> seen.add(f.item()));

    assertThat(seen).containsExactly(password);
  }

  /**
   * An empty search list is simply exhausted.
   */
  @Test
  void next_noStores_empty() {
    assertThat(MultiStoreCursor.findFirst(List.of(), QUERY)).isEmpty();
  }

  private Keychain create(final String name) {
    Keychain keychain = registry.resolve(StoreIdentifier.of(name));
    keychain.create(SECRET);
    return keychain;
  }

  private static KeychainItem item(final String service) {
    return KeychainItem.newItem(ItemClass.GENERIC_PASSWORD)
        .withAttribute(ItemAttribute.SERVICE, AttributeValue.of(service));
  }
}
