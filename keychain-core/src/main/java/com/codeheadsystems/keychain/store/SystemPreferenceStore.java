package com.codeheadsystems.keychain.store;

import java.util.Optional;

/**
 * System-wide key/value preferences, grouped into named preference domains.
 * Writes are buffered until {@link #flush(String)}.
 */
public interface SystemPreferenceStore {

  Optional<byte[]> getValue(String preferenceDomain, String key);

  void setValue(String preferenceDomain, String key, byte[] value);

  void removeValue(String preferenceDomain, String key);

  /**
   * Makes buffered writes durable.
   *
   * @param preferenceDomain the preference domain
   * @throws com.codeheadsystems.keychain.exceptions.KeychainException IO_FAILURE if the write fails
   */
  void flush(String preferenceDomain);
}
