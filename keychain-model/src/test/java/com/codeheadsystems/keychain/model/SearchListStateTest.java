package com.codeheadsystems.keychain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * The type Search list state test.
 */
class SearchListStateTest {

  private static final StoreIdentifier A = StoreIdentifier.of("/k/a.keychain");
  private static final StoreIdentifier B = StoreIdentifier.of("/k/b.keychain");
  private static final StoreIdentifier C = StoreIdentifier.of("/k/c.keychain");

  /**
   * Duplicates are rejected on construction.
   */
  @Test
  void constructor_duplicate_throwsDuplicateMember() {
    assertThatThrownBy(() -> new SearchListState(List.of(A, A), null, null))
        .isInstanceOf(KeychainException.class)
        .satisfies(e -> assertThat(((KeychainException) e).kind()).isEqualTo(ErrorKind.DUPLICATE_MEMBER));
  }

  /**
   * With added appends and rejects members.
   */
  @Test
  void withAdded_appendsOnce() {
    SearchListState state = SearchListState.empty().withAdded(A).withAdded(B);

    assertThat(state.searchList()).containsExactly(A, B);
    assertThatThrownBy(() -> state.withAdded(A))
        .isInstanceOf(KeychainException.class)
        .hasMessageContaining("DUPLICATE_MEMBER");
  }

  /**
   * With renamed rewrites entry and designations in place.
   */
  @Test
  void withRenamed_rewritesEverywhere() {
    SearchListState state = new SearchListState(List.of(A, B), A, A);

    SearchListState renamed = state.withRenamed(A, C);

    assertThat(renamed.searchList()).containsExactly(C, B);
    assertThat(renamed.defaultKeychain()).isEqualTo(C);
    assertThat(renamed.loginKeychain()).isEqualTo(C);
  }

  /**
   * Renaming onto an existing member keeps the renamed position.
   */
  @Test
  void withRenamed_ontoMember_noDuplicate() {
    SearchListState renamed = new SearchListState(List.of(A, B), null, null).withRenamed(A, B);

    assertThat(renamed.searchList()).containsExactly(B);
  }

  /**
   * With removed leaves designations alone.
   */
  @Test
  void withRemoved_keepsDesignations() {
    SearchListState state = new SearchListState(List.of(A, B), A, null).withRemoved(A);

    assertThat(state.searchList()).containsExactly(B);
    assertThat(state.defaultKeychain()).isEqualTo(A);
    assertThat(state.member(A)).isFalse();
  }

  /**
   * Json omits absent designations and reads back equal.
   *
   * @throws Exception the exception
   */
  @Test
  void json_omitsNullDesignations() throws Exception {
    ObjectMapper mapper = new ObjectMapper();
    SearchListState state = new SearchListState(List.of(A), A, null);

    String json = mapper.writeValueAsString(state);

    assertThat(json).doesNotContain("loginKeychain").doesNotContain("empty");
    assertThat(mapper.readValue(json, SearchListState.class)).isEqualTo(state);
  }
}
