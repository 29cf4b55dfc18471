package io.github.awsbind.autoscaling;

import com.fasterxml.jackson.annotation.*;

// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_PutScalingPolicy.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class PutScalingPolicyResponse extends GenericResponse {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Result {
    @JsonProperty("PolicyARN")
    public String policyARN;
  }

  @JsonProperty("PutScalingPolicyResult")
  public Result result = new Result();

  @JsonIgnore
  public String getPolicyARN() {
    return result.policyARN;
  }

}
