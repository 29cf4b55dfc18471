package io.github.awsbind.autoscaling;

import java.util.ArrayList;
import java.util.List;

// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_UpdateAutoScalingGroup.html
public class UpdateAutoScalingGroupOptions {
  public String autoScalingGroupName;
  public final List<String> availabilityZones = new ArrayList<>();
  public int defaultCooldown;
  public int desiredCapacity;
  public int healthCheckGracePeriod;
  public String healthCheckType;
  public String launchConfigurationName;
  public int maxSize;
  public int minSize;
  public String placementGroup;
  public final List<String> terminationPolicies = new ArrayList<>();
  public String vpcZoneIdentifier;
}
