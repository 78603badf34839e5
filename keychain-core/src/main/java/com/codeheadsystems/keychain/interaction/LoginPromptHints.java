package com.codeheadsystems.keychain.interaction;

/**
 * What the login prompt is told about the situation it was raised in.
 *
 * @param itemAccount                the account of the item being stored, if any
 * @param defaultKeychainName        name of the default store, if one is designated
 * @param defaultKeychainUnavailable whether a designated default store is missing
 * @param userName                   the account short name
 * @param userHasOtherKeychains      whether the search list holds more than one store
 * @param suppressResetPanel         true when there is no item to store
 */
public record LoginPromptHints(
    String itemAccount,
    String defaultKeychainName,
    boolean defaultKeychainUnavailable,
    String userName,
    boolean userHasOtherKeychains,
    boolean suppressResetPanel) {
}
