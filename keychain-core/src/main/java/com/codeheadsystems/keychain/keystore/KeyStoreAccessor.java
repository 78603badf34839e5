package com.codeheadsystems.keychain.keystore;

import com.codeheadsystems.keychain.cursor.FoundItem;
import com.codeheadsystems.keychain.model.Certificate;
import com.codeheadsystems.keychain.model.Identity;
import com.codeheadsystems.keychain.registry.Keychain;
import java.util.List;

/**
 * Certificate and identity services the search layer relies on.
 */
public interface KeyStoreAccessor {

  /**
   * Persistent reference to a stored certificate.
   *
   * @param certificate the certificate
   * @return the reference bytes
   */
  byte[] persistentReference(Certificate certificate);

  /**
   * Loads the certificate a persistent reference points at.
   *
   * @param persistentReference the persistent reference
   * @return the certificate
   * @throws com.codeheadsystems.keychain.exceptions.KeychainException INVALID_ITEM_REF if the
   *                                                                   reference is stale or bad
   */
  Certificate certificateFromPersistentReference(byte[] persistentReference);

  Certificate certificateFromItem(FoundItem found);

  /**
   * Pairs a certificate with its private key.
   *
   * @param certificate the certificate
   * @param keychains   where to look for the private key
   * @return the identity
   * @throws com.codeheadsystems.keychain.exceptions.KeychainException NOT_FOUND if no key matches
   */
  Identity identityFor(Certificate certificate, List<Keychain> keychains);
}
