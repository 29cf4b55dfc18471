package io.github.awsbind.autoscaling;

import java.util.ArrayList;
import java.util.List;

/**
 * CreateLaunchConfigurationOptions
 *
 * <p>userData is given raw and base64-encoded on the wire
 */
// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_CreateLaunchConfiguration.html
public class CreateLaunchConfigurationOptions {
  public boolean associatePublicIpAddress;
  public final List<BlockDeviceMapping> blockDeviceMappings = new ArrayList<>();
  public boolean ebsOptimized;
  public String iamInstanceProfile;
  public String imageId;
  public String instanceId;
  public boolean instanceMonitoring;
  public String instanceType;
  public String kernelId;
  public String keyName;
  public String launchConfigurationName;
  public String ramdiskId;
  public final List<String> securityGroups = new ArrayList<>();
  public String spotPrice;
  public byte[] userData;
}
