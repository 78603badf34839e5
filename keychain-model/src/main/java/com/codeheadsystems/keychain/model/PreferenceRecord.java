package com.codeheadsystems.keychain.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Typed view of an identity-preference record.
 * <p>
 * Preferences are stored as generic-password items keyed by (service, {@link #TYPE_TAG},
 * optional key usage). The service string doubles as the label; the account holds the
 * certificate's label and the generic attribute holds the persistent certificate reference.
 *
 * @param service              the symbolic name the preference applies to
 * @param keyUsage             key-usage tag, 0 for any usage
 * @param account              the certificate label
 * @param certificateReference persistent reference to the preferred certificate
 */
public record PreferenceRecord(
    String service,
    int keyUsage,
    String account,
    byte[] certificateReference) {

  /**
   * Type attribute marking a generic item as an identity preference.
   */
  public static final AttributeValue TYPE_TAG = AttributeValue.fourCharCode("iprf");

  /**
   * Creator code stamped on newly created preference items.
   */
  public static final AttributeValue CREATOR = AttributeValue.fourCharCode("kchn");

  public PreferenceRecord {
    Objects.requireNonNull(service, "service");
    certificateReference = certificateReference == null ? new byte[0] : certificateReference.clone();
  }

  /**
   * Query locating preference items for a service.
   *
   * @param service  the service, or null to match any preference
   * @param keyUsage the key usage, 0 to ignore usage
   * @return the item query
   */
  public static ItemQuery query(final String service, final int keyUsage) {
    ItemQuery query = ItemQuery.forClass(ItemClass.GENERIC_PASSWORD);
    if (service != null) {
      query = query.where(ItemAttribute.SERVICE, AttributeValue.of(service));
    }
    query = query.where(ItemAttribute.TYPE, TYPE_TAG);
    if (keyUsage != 0) {
      query = query.where(ItemAttribute.SCRIPT_CODE, AttributeValue.of(keyUsage));
    }
    return query;
  }

  /**
   * Reads the typed view back out of a stored item.
   *
   * @param item the item
   * @return the preference record
   * @throws IllegalArgumentException if the item is not a preference item
   */
  public static PreferenceRecord fromItem(final KeychainItem item) {
    if (item.itemClass() != ItemClass.GENERIC_PASSWORD
        || !item.attribute(ItemAttribute.TYPE).map(TYPE_TAG::equals).orElse(false)) {
      throw new IllegalArgumentException("Not an identity preference item: " + item);
    }
    return new PreferenceRecord(
        item.attribute(ItemAttribute.SERVICE).map(AttributeValue::asString).orElse(""),
        item.attribute(ItemAttribute.SCRIPT_CODE).map(AttributeValue::asInt).orElse(0),
        item.attribute(ItemAttribute.ACCOUNT).map(AttributeValue::asString).orElse(null),
        item.attribute(ItemAttribute.GENERIC).map(AttributeValue::bytes).orElse(null));
  }

  /**
   * Writes this record's attributes onto an item, keeping its record id. A fresh item is used
   * when {@code base} is null.
   *
   * @param base the existing item, or null
   * @return the keychain item
   */
  public KeychainItem applyTo(final KeychainItem base) {
    KeychainItem item = base == null
        ? KeychainItem.newItem(ItemClass.GENERIC_PASSWORD).withAttribute(ItemAttribute.CREATOR, CREATOR)
        : base;
    item = item
        .withAttribute(ItemAttribute.SERVICE, AttributeValue.of(service))
        .withAttribute(ItemAttribute.LABEL, AttributeValue.of(service))
        .withAttribute(ItemAttribute.TYPE, TYPE_TAG)
        .withAttribute(ItemAttribute.GENERIC, new AttributeValue(certificateReference));
    if (account != null) {
      item = item.withAttribute(ItemAttribute.ACCOUNT, AttributeValue.of(account));
    }
    if (keyUsage != 0) {
      item = item.withAttribute(ItemAttribute.SCRIPT_CODE, AttributeValue.of(keyUsage));
    }
    return item;
  }

  @Override
  public byte[] certificateReference() {
    return certificateReference.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PreferenceRecord other
        && service.equals(other.service)
        && keyUsage == other.keyUsage
        && Objects.equals(account, other.account)
        && Arrays.equals(certificateReference, other.certificateReference);
  }

  @Override
  public int hashCode() {
    return Objects.hash(service, keyUsage, account, Arrays.hashCode(certificateReference));
  }
}
