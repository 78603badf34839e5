package com.codeheadsystems.keychain.model;

import java.util.Objects;

/**
 * A certificate paired with its private key.
 *
 * @param certificate the certificate
 * @param privateKey  location of the matching private key item
 */
public record Identity(Certificate certificate, ItemReference privateKey) {

  public Identity {
    Objects.requireNonNull(certificate, "certificate");
    Objects.requireNonNull(privateKey, "privateKey");
  }
}
