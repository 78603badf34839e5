package com.codeheadsystems.keychain.naming;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/**
 * The type Hierarchical name test.
 */
class HierarchicalNameTest {

  /**
   * Parse splits every component.
   */
  @Test
  void parse_allComponents() {
    HierarchicalName name = HierarchicalName.parse("https://user@host:8443/a/b?q=1#frag").orElseThrow();

    assertThat(name.scheme()).isEqualTo("https");
    assertThat(name.authority()).isEqualTo("user@host:8443");
    assertThat(name.path()).isEqualTo("/a/b");
    assertThat(name.query()).isEqualTo("q=1");
    assertThat(name.fragment()).isEqualTo("frag");
    assertThat(name.toString()).isEqualTo("https://user@host:8443/a/b?q=1#frag");
  }

  /**
   * Parent drops query and fragment.
   */
  @Test
  void parent_dropsQueryAndFragment() {
    HierarchicalName name = HierarchicalName.parse("https://host/a/b?q=1#frag").orElseThrow();

    assertThat(name.parent()).map(HierarchicalName::toString).contains("https://host/a");
  }

  /**
   * No parent at the authority.
   */
  @Test
  void parent_root_empty() {
    assertThat(HierarchicalName.parse("https://host").orElseThrow().parent()).isEmpty();
  }
}
