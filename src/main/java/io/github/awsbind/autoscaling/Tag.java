package io.github.awsbind.autoscaling;

import com.fasterxml.jackson.annotation.*;
import com.google.gson.Gson;

// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_Tag.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class Tag {
  @JsonProperty("Key")
  public String key;
  @JsonProperty("Value")
  public String value;
  @JsonProperty("PropagateAtLaunch")
  public boolean propagateAtLaunch;
  @JsonProperty("ResourceId")
  public String resourceId; // the group name
  @JsonProperty("ResourceType")
  public String resourceType;

  public Tag() {
  }

  public Tag(String key, String value, boolean propagateAtLaunch) {
    this.key = key;
    this.value = value;
    this.propagateAtLaunch = propagateAtLaunch;
  }

  @Override
  public String toString() {
    return new Gson().toJson(this);
  }
}
