package com.codeheadsystems.keychain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Raw attribute bytes with value semantics, so values can be compared and used as map keys.
 * Strings are UTF-8, integers and four-character codes are 4 bytes big-endian.
 *
 * @param bytes the raw value
 */
public record AttributeValue(byte[] bytes) {

  public AttributeValue {
    bytes = Objects.requireNonNull(bytes, "bytes").clone();
  }

  /**
   * Jackson entry point.
   *
   * @param bytes the bytes
   * @return the attribute value
   */
  @JsonCreator
  public static AttributeValue of(final byte[] bytes) {
    return new AttributeValue(bytes);
  }

  /**
   * Of attribute value.
   *
   * @param value the value
   * @return the attribute value
   */
  public static AttributeValue of(final String value) {
    return new AttributeValue(value.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Of attribute value.
   *
   * @param value the value
   * @return the attribute value
   */
  public static AttributeValue of(final int value) {
    return new AttributeValue(ByteBuffer.allocate(Integer.BYTES).putInt(value).array());
  }

  /**
   * A four-character type code such as {@code iprf}.
   *
   * @param code exactly four ASCII characters
   * @return the attribute value
   */
  public static AttributeValue fourCharCode(final String code) {
    if (code.length() != 4) {
      throw new IllegalArgumentException("Four character code required: " + code);
    }
    return new AttributeValue(code.getBytes(StandardCharsets.US_ASCII));
  }

  @Override
  @JsonValue
  public byte[] bytes() {
    return bytes.clone();
  }

  /**
   * Length int.
   *
   * @return the byte length
   */
  public int length() {
    return bytes.length;
  }

  /**
   * As string string.
   *
   * @return the value decoded as UTF-8
   */
  public String asString() {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  /**
   * As int int.
   *
   * @return the value decoded as a big-endian integer
   */
  public int asInt() {
    if (bytes.length != Integer.BYTES) {
      throw new IllegalStateException("Not an integer attribute (" + bytes.length + " bytes)");
    }
    return ByteBuffer.wrap(bytes).getInt();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof AttributeValue other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "AttributeValue[" + bytes.length + " bytes]";
  }
}
