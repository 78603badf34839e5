package com.codeheadsystems.keychain.cursor;

import com.codeheadsystems.keychain.model.KeychainItem;
import com.codeheadsystems.keychain.registry.Keychain;

/**
 * An item and the store it was found in.
 *
 * @param keychain the keychain
 * @param item     the item
 */
public record FoundItem(Keychain keychain, KeychainItem item) {
}
