package com.codeheadsystems.keychain.model;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One record inside a store.
 *
 * @param recordId   store-assigned identifier, null until the item has been added to a store
 * @param itemClass  the record class
 * @param attributes attribute values by tag
 * @param data       the secret payload, may be empty
 */
public record KeychainItem(
    String recordId,
    ItemClass itemClass,
    Map<ItemAttribute, AttributeValue> attributes,
    byte[] data) {

  public KeychainItem {
    Objects.requireNonNull(itemClass, "itemClass");
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    data = data == null ? new byte[0] : data.clone();
  }

  /**
   * A new, not yet stored item of the given class.
   *
   * @param itemClass the item class
   * @return the keychain item
   */
  public static KeychainItem newItem(final ItemClass itemClass) {
    return new KeychainItem(null, itemClass, Map.of(), null);
  }

  /**
   * Attribute optional.
   *
   * @param attribute the attribute
   * @return the value, if set
   */
  public Optional<AttributeValue> attribute(final ItemAttribute attribute) {
    return Optional.ofNullable(attributes.get(attribute));
  }

  /**
   * Copy with one attribute set.
   *
   * @param attribute the attribute
   * @param value     the value
   * @return the keychain item
   */
  public KeychainItem withAttribute(final ItemAttribute attribute, final AttributeValue value) {
    Map<ItemAttribute, AttributeValue> copy = new EnumMap<>(ItemAttribute.class);
    copy.putAll(attributes);
    copy.put(attribute, value);
    return new KeychainItem(recordId, itemClass, copy, data);
  }

  /**
   * Copy with the store-assigned record id.
   *
   * @param id the id
   * @return the keychain item
   */
  public KeychainItem withRecordId(final String id) {
    return new KeychainItem(id, itemClass, attributes, data);
  }

  /**
   * Copy with a new payload.
   *
   * @param newData the data
   * @return the keychain item
   */
  public KeychainItem withData(final byte[] newData) {
    return new KeychainItem(recordId, itemClass, attributes, newData);
  }

  @Override
  public byte[] data() {
    return data.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof KeychainItem other
        && Objects.equals(recordId, other.recordId)
        && itemClass == other.itemClass
        && attributes.equals(other.attributes)
        && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return Objects.hash(recordId, itemClass, attributes, Arrays.hashCode(data));
  }

  @Override
  public String toString() {
    return "KeychainItem[recordId=" + recordId + ", itemClass=" + itemClass
        + ", attributes=" + attributes.keySet() + "]";
  }
}
