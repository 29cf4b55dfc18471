package io.github.awsbind.dynamodb;

import com.google.common.base.*;

/**
 * Key
 *
 * <p>key values of one item; names and types come from the table's {@link PrimaryKey}
 */
public final class Key {

  private final String hashKey;
  private final String rangeKey;

  public Key(String hashKey) {
    this(hashKey, null);
  }

  public Key(String hashKey, String rangeKey) {
    this.hashKey = Preconditions.checkNotNull(hashKey, "hashKey");
    this.rangeKey = rangeKey;
  }

  public String getHashKey() {
    return hashKey;
  }

  /**
   * range value, or null
   */
  public String getRangeKey() {
    return rangeKey;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Key))
      return false;
    Key that = (Key) o;
    return hashKey.equals(that.hashKey) && Objects.equal(rangeKey, that.rangeKey);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(hashKey, rangeKey);
  }

  public String toString() {
    return MoreObjects.toStringHelper(this).omitNullValues().add("hashKey", hashKey).add("rangeKey", rangeKey).toString();
  }

}
