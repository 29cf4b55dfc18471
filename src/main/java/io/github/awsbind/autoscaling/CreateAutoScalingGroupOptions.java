package io.github.awsbind.autoscaling;

import java.util.ArrayList;
import java.util.List;

/**
 * CreateAutoScalingGroupOptions
 *
 * <p>the sizes are always sent; other empty strings and zeros are left out of the request
 */
// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_CreateAutoScalingGroup.html
public class CreateAutoScalingGroupOptions {
  public String autoScalingGroupName;
  public final List<String> availabilityZones = new ArrayList<>();
  public int defaultCooldown; // seconds
  public int desiredCapacity;
  public int healthCheckGracePeriod; // seconds
  public String healthCheckType; // EC2 or ELB
  public String instanceId;
  public String launchConfigurationName;
  public final List<String> loadBalancerNames = new ArrayList<>();
  public int maxSize;
  public int minSize;
  public String placementGroup;
  public final List<Tag> tags = new ArrayList<>();
  public final List<String> terminationPolicies = new ArrayList<>();
  public String vpcZoneIdentifier; // comma separated subnet ids
}
