package io.github.awsbind.rds;

import com.fasterxml.jackson.annotation.*;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Endpoint {
  @JsonProperty("Address")
  public String address;
  @JsonProperty("Port")
  public int port;
}
