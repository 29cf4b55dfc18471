package io.github.awsbind.rds;

import com.fasterxml.jackson.annotation.*;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ResponseMetadata {
  @JsonProperty("RequestId")
  public String requestId;
}
