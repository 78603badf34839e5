package com.codeheadsystems.keychain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Location of one item: the store holding it and the store-assigned record id.
 * Encoded bytes of this value serve as the persistent item reference.
 *
 * @param keychain the store
 * @param recordId the record id inside that store
 */
public record ItemReference(
    @JsonProperty("keychain") StoreIdentifier keychain,
    @JsonProperty("recordId") String recordId) {

  public ItemReference {
    Objects.requireNonNull(keychain, "keychain");
    Objects.requireNonNull(recordId, "recordId");
  }
}
