package io.github.awsbind.dynamodb;

// https://docs.aws.amazon.com/amazondynamodb/latest/APIReference/API_AttributeValue.html
public enum AttributeType {

  STRING("S", false),
  NUMBER("N", false),
  BINARY("B", false),
  STRING_SET("SS", true),
  NUMBER_SET("NS", true),
  BINARY_SET("BS", true);

  private final String tag;
  private final boolean set;

  AttributeType(String tag, boolean set) {
    this.tag = tag;
    this.set = set;
  }

  /**
   * the wire tag, e.g., "S", "NS"
   */
  public String tag() {
    return tag;
  }

  public boolean isSet() {
    return set;
  }

  /**
   * fromTag
   * 
   * @param tag e.g., "SS"
   * @return the matching type, or null for any other tag
   */
  public static AttributeType fromTag(String tag) {
    for (AttributeType type : values()) {
      if (type.tag.equals(tag))
        return type;
    }
    return null;
  }

}
