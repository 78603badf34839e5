package com.codeheadsystems.keychain.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent {@link SystemPreferenceStore}; flushing is a no-op.
 */
public class InMemorySystemPreferenceStore implements SystemPreferenceStore {

  private final Map<String, Map<String, byte[]>> domains = new ConcurrentHashMap<>();

  @Override
  public Optional<byte[]> getValue(final String preferenceDomain, final String key) {
    byte[] value = domain(preferenceDomain).get(key);
    return value == null ? Optional.empty() : Optional.of(value.clone());
  }

  @Override
  public void setValue(final String preferenceDomain, final String key, final byte[] value) {
    domain(preferenceDomain).put(key, value.clone());
  }

  @Override
  public void removeValue(final String preferenceDomain, final String key) {
    domain(preferenceDomain).remove(key);
  }

  @Override
  public void flush(final String preferenceDomain) {
    // nothing buffered
  }

  private Map<String, byte[]> domain(final String preferenceDomain) {
    return domains.computeIfAbsent(preferenceDomain, d -> new ConcurrentHashMap<>());
  }
}
