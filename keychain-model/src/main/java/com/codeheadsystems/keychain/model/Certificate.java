package com.codeheadsystems.keychain.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A stored certificate as seen by the search layer. Parsing and validation belong to the key
 * store collaborator; this layer only needs the fields used for labels, issuer filtering and
 * pairing with a private key.
 *
 * @param reference     where the certificate item lives
 * @param label         the inferred label (usually the subject common name)
 * @param issuer        the issuer distinguished name
 * @param publicKeyHash hash of the subject public key, shared with the matching private key item
 * @param encoded       the DER encoding
 */
public record Certificate(
    ItemReference reference,
    String label,
    String issuer,
    byte[] publicKeyHash,
    byte[] encoded) {

  public Certificate {
    publicKeyHash = publicKeyHash == null ? new byte[0] : publicKeyHash.clone();
    encoded = encoded == null ? new byte[0] : encoded.clone();
  }

  @Override
  public byte[] publicKeyHash() {
    return publicKeyHash.clone();
  }

  @Override
  public byte[] encoded() {
    return encoded.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Certificate other
        && Objects.equals(reference, other.reference)
        && Objects.equals(label, other.label)
        && Objects.equals(issuer, other.issuer)
        && Arrays.equals(publicKeyHash, other.publicKeyHash)
        && Arrays.equals(encoded, other.encoded);
  }

  @Override
  public int hashCode() {
    return Objects.hash(reference, label, issuer, Arrays.hashCode(publicKeyHash));
  }

  @Override
  public String toString() {
    return "Certificate[label=" + label + ", issuer=" + issuer + ", reference=" + reference + "]";
  }
}
