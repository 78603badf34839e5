package com.codeheadsystems.keychain.keystore;

import org.bouncycastle.crypto.digests.SHA1Digest;

/**
 * The public-key hash that pairs a certificate with its private key and keys the system identity
 * preferences: SHA-1 over the encoded subject public key.
 */
public final class PublicKeyHashes {

  private PublicKeyHashes() {
  }

  /**
   * Sha 1 byte [ ].
   *
   * @param publicKey the public key
   * @return the 20-byte hash
   */
  public static byte[] sha1(final byte[] publicKey) {
    SHA1Digest digest = new SHA1Digest();
    digest.update(publicKey, 0, publicKey.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }
}
