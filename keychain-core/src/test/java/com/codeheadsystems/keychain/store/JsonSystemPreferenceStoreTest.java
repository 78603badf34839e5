package com.codeheadsystems.keychain.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * The type Json system preference store test.
 */
class JsonSystemPreferenceStoreTest {

  @TempDir Path directory;

  /**
   * Flushed values are visible to a new instance as hex.
   *
   * @throws Exception the exception
   */
  @Test
  void flush_persistsHexValues() throws Exception {
    JsonSystemPreferenceStore store = new JsonSystemPreferenceStore(directory, new ObjectMapper());
    store.setValue("keychain.systemidentities", "systemdefault", new byte[]{(byte) 0xca, (byte) 0xfe});
    store.flush("keychain.systemidentities");

    JsonSystemPreferenceStore reopened = new JsonSystemPreferenceStore(directory, new ObjectMapper());

    assertThat(Files.readString(directory.resolve("keychain.systemidentities.json"))).contains("cafe");
    assertThat(reopened.getValue("keychain.systemidentities", "systemdefault"))
        .hasValueSatisfying(v -> assertThat(v).containsExactly(0xca, 0xfe));
  }

  /**
   * Unflushed writes are not persisted.
   */
  @Test
  void setValue_withoutFlush_notPersisted() {
    JsonSystemPreferenceStore store = new JsonSystemPreferenceStore(directory, new ObjectMapper());
    store.setValue("d", "k", new byte[]{1});

    assertThat(new JsonSystemPreferenceStore(directory, new ObjectMapper()).getValue("d", "k")).isEmpty();
    assertThat(store.getValue("d", "k")).isPresent();
  }

  /**
   * Removed values are gone after a flush.
   */
  @Test
  void removeValue_thenFlush() {
    JsonSystemPreferenceStore store = new JsonSystemPreferenceStore(directory, new ObjectMapper());
    store.setValue("d", "k", new byte[]{1});
    store.flush("d");
    store.removeValue("d", "k");
    store.flush("d");

    assertThat(new JsonSystemPreferenceStore(directory, new ObjectMapper()).getValue("d", "k")).isEmpty();
  }

  /**
   * A flush merges with values another instance flushed in the meantime.
   */
  @Test
  void flush_twoInstances_keepsOtherInstancesWrite() {
    JsonSystemPreferenceStore first = new JsonSystemPreferenceStore(directory, new ObjectMapper());
    JsonSystemPreferenceStore second = new JsonSystemPreferenceStore(directory, new ObjectMapper());
    assertThat(first.getValue("d", "kerberos.kdc")).isEmpty();

    second.setValue("d", "kerberos.kdc", new byte[]{2});
    second.flush("d");
    first.setValue("d", "systemdefault", new byte[]{1});
    first.flush("d");

    JsonSystemPreferenceStore reopened = new JsonSystemPreferenceStore(directory, new ObjectMapper());
    assertThat(reopened.getValue("d", "kerberos.kdc")).hasValueSatisfying(v -> assertThat(v).containsExactly(2));
    assertThat(reopened.getValue("d", "systemdefault")).hasValueSatisfying(v -> assertThat(v).containsExactly(1));
  }

  /**
   * A value flushed by another instance is visible without reopening.
   */
  @Test
  void getValue_seesOtherInstancesFlush() {
    JsonSystemPreferenceStore first = new JsonSystemPreferenceStore(directory, new ObjectMapper());
    JsonSystemPreferenceStore second = new JsonSystemPreferenceStore(directory, new ObjectMapper());
    assertThat(first.getValue("d", "kerberos.kdc")).isEmpty();

    second.setValue("d", "kerberos.kdc", new byte[]{2});
    second.flush("d");

    assertThat(first.getValue("d", "kerberos.kdc")).hasValueSatisfying(v -> assertThat(v).containsExactly(2));
  }

  /**
   * A pending removal hides a persisted value and only that key is dropped on flush.
   */
  @Test
  void removeValue_pending_mergesOnlyThatKey() {
    JsonSystemPreferenceStore first = new JsonSystemPreferenceStore(directory, new ObjectMapper());
    first.setValue("d", "a", new byte[]{1});
    first.setValue("d", "b", new byte[]{2});
    first.flush("d");
    JsonSystemPreferenceStore second = new JsonSystemPreferenceStore(directory, new ObjectMapper());

    second.removeValue("d", "a");
    assertThat(second.getValue("d", "a")).isEmpty();
    first.setValue("d", "c", new byte[]{3});
    first.flush("d");
    second.flush("d");

    JsonSystemPreferenceStore reopened = new JsonSystemPreferenceStore(directory, new ObjectMapper());
    assertThat(reopened.getValue("d", "a")).isEmpty();
    assertThat(reopened.getValue("d", "b")).isPresent();
    assertThat(reopened.getValue("d", "c")).isPresent();
  }
}
