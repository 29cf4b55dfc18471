package io.github.awsbind.dynamodb;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.*;
import com.google.common.collect.*;

/**
 * Attribute
 *
 * <p>one named, typed value; scalar types carry {@link #getValue()}, set types carry {@link #getSetValues()}
 * <p>numbers stay decimal text, never parsed
 * <p>immutable
 */
public final class Attribute {

  private final AttributeType type;
  private final String name;
  private final String value;
  private final List<String> setValues;

  private Attribute(AttributeType type, String name, String value, List<String> setValues) {
    this.type = Preconditions.checkNotNull(type, "type");
    this.name = Preconditions.checkNotNull(name, "name");
    this.value = value;
    this.setValues = setValues;
  }

  public static Attribute of(AttributeType type, String name, String value) {
    Preconditions.checkArgument(!type.isSet(), "%s is a set type", type);
    return new Attribute(type, name, Preconditions.checkNotNull(value, "value"), null);
  }

  public static Attribute ofSet(AttributeType type, String name, Iterable<String> setValues) {
    Preconditions.checkArgument(type.isSet(), "%s is not a set type", type);
    return new Attribute(type, name, null, ImmutableList.copyOf(setValues));
  }

  public static Attribute newString(String name, String value) {
    return of(AttributeType.STRING, name, value);
  }

  public static Attribute newNumber(String name, String value) {
    return of(AttributeType.NUMBER, name, value);
  }

  public static Attribute newBinary(String name, String value) {
    return of(AttributeType.BINARY, name, value);
  }

  public static Attribute newStringSet(String name, String... values) {
    return ofSet(AttributeType.STRING_SET, name, Arrays.asList(values));
  }

  public static Attribute newNumberSet(String name, String... values) {
    return ofSet(AttributeType.NUMBER_SET, name, Arrays.asList(values));
  }

  public static Attribute newBinarySet(String name, String... values) {
    return ofSet(AttributeType.BINARY_SET, name, Arrays.asList(values));
  }

  public AttributeType getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  /**
   * scalar value, null for set types
   */
  public String getValue() {
    return value;
  }

  /**
   * set values in insertion order, null for scalar types
   */
  public List<String> getSetValues() {
    return setValues;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Attribute))
      return false;
    Attribute that = (Attribute) o;
    return type == that.type && name.equals(that.name) && Objects.equal(value, that.value) && Objects.equal(setValues, that.setValues);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(type, name, value, setValues);
  }

  public String toString() {
    return MoreObjects.toStringHelper(this)
        //
        .add("type", type.tag()).add("name", name).add("value", type.isSet() ? setValues : value).toString();
  }

}
