package io.github.awsbind.autoscaling;

import com.fasterxml.jackson.annotation.*;

// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_TerminateInstanceInAutoScalingGroup.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class TerminateInstanceInAutoScalingGroupResponse extends GenericResponse {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Result {
    @JsonProperty("Activity")
    public Activity activity;
  }

  @JsonProperty("TerminateInstanceInAutoScalingGroupResult")
  public Result result = new Result();

  @JsonIgnore
  public Activity getActivity() {
    return result.activity;
  }

}
