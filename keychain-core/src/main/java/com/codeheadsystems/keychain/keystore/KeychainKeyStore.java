package com.codeheadsystems.keychain.keystore;

import com.codeheadsystems.keychain.cursor.FoundItem;
import com.codeheadsystems.keychain.cursor.MultiStoreCursor;
import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.model.AttributeValue;
import com.codeheadsystems.keychain.model.Certificate;
import com.codeheadsystems.keychain.model.Identity;
import com.codeheadsystems.keychain.model.ItemAttribute;
import com.codeheadsystems.keychain.model.ItemClass;
import com.codeheadsystems.keychain.model.ItemQuery;
import com.codeheadsystems.keychain.model.ItemReference;
import com.codeheadsystems.keychain.model.KeychainItem;
import com.codeheadsystems.keychain.registry.Keychain;
import com.codeheadsystems.keychain.registry.KeychainRegistry;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link KeyStoreAccessor} over keychain items. Certificates are CERTIFICATE items carrying
 * LABEL, ISSUER and PUBLIC_KEY_HASH; private keys are PRIVATE_KEY items carrying the same
 * PUBLIC_KEY_HASH.
 */
@Singleton
public class KeychainKeyStore implements KeyStoreAccessor {

  private static final Logger log = LoggerFactory.getLogger(KeychainKeyStore.class);

  private final KeychainRegistry registry;
  private final PersistentReferences persistentReferences;

  /**
   * Instantiates a new Keychain key store.
   *
   * @param registry             the registry
   * @param persistentReferences the persistent references
   */
  @Inject
  public KeychainKeyStore(final KeychainRegistry registry, final PersistentReferences persistentReferences) {
    log.info("KeychainKeyStore()");
    this.registry = registry;
    this.persistentReferences = persistentReferences;
  }

  /**
   * Stores a certificate.
   *
   * @param keychain  the keychain
   * @param label     the label
   * @param issuer    the issuer, or null if the certificate names none
   * @param publicKey the encoded subject public key
   * @param encoded   the DER certificate
   * @return the certificate
   */
  public Certificate importCertificate(final Keychain keychain, final String label, final String issuer,
                                       final byte[] publicKey, final byte[] encoded) {
    KeychainItem item = KeychainItem.newItem(ItemClass.CERTIFICATE)
        .withAttribute(ItemAttribute.LABEL, AttributeValue.of(label))
        .withAttribute(ItemAttribute.PUBLIC_KEY_HASH, AttributeValue.of(PublicKeyHashes.sha1(publicKey)))
        .withData(encoded);
    if (issuer != null) {
      item = item.withAttribute(ItemAttribute.ISSUER, AttributeValue.of(issuer));
    }
    KeychainItem stored = keychain.add(item);
    log.debug("importCertificate({}, {})", keychain.identifier(), label);
    return certificateFromItem(new FoundItem(keychain, stored));
  }

  /**
   * Stores a private key paired with the given public key.
   *
   * @param keychain   the keychain
   * @param publicKey  the encoded public key
   * @param privateKey the private key material
   * @return the reference to the stored key
   */
  public ItemReference importPrivateKey(final Keychain keychain, final byte[] publicKey, final byte[] privateKey) {
    KeychainItem item = KeychainItem.newItem(ItemClass.PRIVATE_KEY)
        .withAttribute(ItemAttribute.PUBLIC_KEY_HASH, AttributeValue.of(PublicKeyHashes.sha1(publicKey)))
        .withData(privateKey);
    KeychainItem stored = keychain.add(item);
    return new ItemReference(keychain.identifier(), stored.recordId());
  }

  @Override
  public byte[] persistentReference(final Certificate certificate) {
    if (certificate.reference() == null) {
      throw new KeychainException(ErrorKind.INVALID_ITEM_REF, "Certificate is not stored in a keychain");
    }
    return persistentReferences.encode(certificate.reference());
  }

  @Override
  public Certificate certificateFromPersistentReference(final byte[] persistentReference) {
    ItemReference reference = persistentReferences.decode(persistentReference);
    Keychain keychain = registry.resolve(reference.keychain());
    KeychainItem item;
    try {
      item = keychain.find(reference.recordId())
          .orElseThrow(() -> new KeychainException(ErrorKind.INVALID_ITEM_REF, "Stale reference " + reference));
    } catch (KeychainException e) {
      if (e.is(ErrorKind.INVALID_ITEM_REF)) {
        throw e;
      }
      throw new KeychainException(ErrorKind.INVALID_ITEM_REF, "Unreadable reference " + reference, e);
    }
    return certificateFromItem(new FoundItem(keychain, item));
  }

  @Override
  public Certificate certificateFromItem(final FoundItem found) {
    KeychainItem item = found.item();
    if (item.itemClass() != ItemClass.CERTIFICATE) {
      throw new KeychainException(ErrorKind.INVALID_ITEM_REF, "Not a certificate: " + item.recordId());
    }
    return new Certificate(
        new ItemReference(found.keychain().identifier(), item.recordId()),
        item.attribute(ItemAttribute.LABEL).map(AttributeValue::asString).orElse(null),
        item.attribute(ItemAttribute.ISSUER).map(AttributeValue::asString).orElse(null),
        item.attribute(ItemAttribute.PUBLIC_KEY_HASH).map(AttributeValue::bytes).orElse(null),
        item.data());
  }

  @Override
  public Identity identityFor(final Certificate certificate, final List<Keychain> keychains) {
    ItemQuery query = ItemQuery.forClass(ItemClass.PRIVATE_KEY)
        .where(ItemAttribute.PUBLIC_KEY_HASH, AttributeValue.of(certificate.publicKeyHash()));
    FoundItem key = MultiStoreCursor.findFirst(keychains, query)
        .orElseThrow(() -> new KeychainException(ErrorKind.NOT_FOUND,
            "No private key for certificate " + certificate.label()));
    return new Identity(certificate, new ItemReference(key.keychain().identifier(), key.item().recordId()));
  }
}
