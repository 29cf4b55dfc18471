package io.github.awsbind.autoscaling;

import com.fasterxml.jackson.annotation.*;
import com.google.gson.Gson;

/**
 * Instance
 *
 * <p>an ec2 instance as seen by its group
 */
// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_AutoScalingInstanceDetails.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class Instance {
  @JsonProperty("AutoScalingGroupName")
  public String autoScalingGroupName;
  @JsonProperty("AvailabilityZone")
  public String availabilityZone;
  @JsonProperty("HealthStatus")
  public String healthStatus;
  @JsonProperty("InstanceId")
  public String instanceId;
  @JsonProperty("LaunchConfigurationName")
  public String launchConfigurationName;
  @JsonProperty("LifecycleState")
  public String lifecycleState;

  @Override
  public String toString() {
    return new Gson().toJson(this);
  }
}
