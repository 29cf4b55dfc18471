package io.github.awsbind.dynamodb;

import java.nio.charset.StandardCharsets;
import java.util.*;

import com.google.common.base.*;

/**
 * Item
 *
 * <p>one record: attributes in the order they were added
 * <p>not thread-safe
 */
public class Item {

  private final List<Attribute> attributes = new ArrayList<>();

  public Item() {
  }

  public Item(Attribute... attributes) {
    for (Attribute attribute : attributes)
      addAttribute(attribute);
  }

  public Item addAttribute(Attribute attribute) {
    attributes.add(Preconditions.checkNotNull(attribute, "attribute"));
    return this;
  }

  /**
   * addAttributesFromMap
   * 
   * <p>appends in the map's iteration order
   */
  public Item addAttributesFromMap(Map<String, Attribute> attributes) {
    for (Attribute attribute : attributes.values())
      addAttribute(attribute);
    return this;
  }

  public List<Attribute> getAttributes() {
    return Collections.unmodifiableList(attributes);
  }

  /**
   * getAttribute
   * 
   * @return the first attribute with this name, or null
   */
  public Attribute getAttribute(String name) {
    for (Attribute attribute : attributes) {
      if (attribute.getName().equals(name))
        return attribute;
    }
    return null;
  }

  public boolean isEmpty() {
    return attributes.isEmpty();
  }

  /**
   * size
   * 
   * <p>utf-8 byte length of the scalar values; set values do not count
   * <p>used only to check batch limits before sending
   */
  public int size() {
    int size = 0;
    for (Attribute attribute : attributes) {
      if (attribute.getValue() != null)
        size += attribute.getValue().getBytes(StandardCharsets.UTF_8).length;
    }
    return size;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Item))
      return false;
    return attributes.equals(((Item) o).attributes);
  }

  @Override
  public int hashCode() {
    return attributes.hashCode();
  }

  public String toString() {
    return MoreObjects.toStringHelper(this).add("attributes", attributes).toString();
  }

}
