package com.codeheadsystems.keychain.keystore;

import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.model.ItemReference;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Encodes item references as opaque bytes that survive restarts (JSON of the store identifier and
 * record id).
 */
@Singleton
public class PersistentReferences {

  private final ObjectMapper objectMapper;

  @Inject
  public PersistentReferences(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Encode byte [ ].
   *
   * @param reference the reference
   * @return the persistent reference
   */
  public byte[] encode(final ItemReference reference) {
    try {
      return objectMapper.writeValueAsBytes(reference);
    } catch (JsonProcessingException e) {
      throw new KeychainException(ErrorKind.INVALID_ITEM_REF, "Unable to encode " + reference, e);
    }
  }

  /**
   * Decode item reference.
   *
   * @param persistentReference the persistent reference
   * @return the item reference
   */
  public ItemReference decode(final byte[] persistentReference) {
    if (persistentReference == null || persistentReference.length == 0) {
      throw new KeychainException(ErrorKind.INVALID_ITEM_REF, "Empty persistent reference");
    }
    try {
      return objectMapper.readValue(persistentReference, ItemReference.class);
    } catch (IOException | IllegalArgumentException e) {
      throw new KeychainException(ErrorKind.INVALID_ITEM_REF, "Malformed persistent reference", e);
    }
  }
}
