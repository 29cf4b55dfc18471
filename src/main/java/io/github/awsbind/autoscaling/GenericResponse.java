package io.github.awsbind.autoscaling;

import com.fasterxml.jackson.annotation.*;

/**
 * GenericResponse
 *
 * <p>acknowledgement of the actions that return no result, e.g., DeleteAutoScalingGroup
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenericResponse {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ResponseMetadata {
    @JsonProperty("RequestId")
    public String requestId;
  }

  @JsonProperty("ResponseMetadata")
  public ResponseMetadata responseMetadata = new ResponseMetadata();

  @JsonIgnore
  public String getRequestId() {
    return responseMetadata.requestId;
  }

}
