package io.github.awsbind.dynamodb;

import com.google.common.base.*;

/**
 * PrimaryKey
 *
 * <p>a table's key schema: the hash key attribute and, optionally, the range key attribute
 * <p>only name and type of the attributes are used
 */
public class PrimaryKey {

  private final Attribute keyAttribute;
  private final Attribute rangeAttribute;

  public PrimaryKey(Attribute keyAttribute) {
    this(keyAttribute, null);
  }

  public PrimaryKey(Attribute keyAttribute, Attribute rangeAttribute) {
    this.keyAttribute = Preconditions.checkNotNull(keyAttribute, "keyAttribute");
    Preconditions.checkArgument(!keyAttribute.getType().isSet(), "hash key must be scalar");
    Preconditions.checkArgument(rangeAttribute == null || !rangeAttribute.getType().isSet(), "range key must be scalar");
    this.rangeAttribute = rangeAttribute;
  }

  public Attribute getKeyAttribute() {
    return keyAttribute;
  }

  public Attribute getRangeAttribute() {
    return rangeAttribute;
  }

  public boolean hasRange() {
    return rangeAttribute != null;
  }

  public String toString() {
    return MoreObjects.toStringHelper(this).add("key", keyAttribute).add("range", rangeAttribute).toString();
  }

}
