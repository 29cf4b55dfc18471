package io.github.awsbind.autoscaling;

import java.util.*;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.dataformat.xml.annotation.*;
import com.google.gson.Gson;

/**
 * LaunchConfiguration
 *
 * <p>userData is returned base64-encoded, as the service holds it
 */
// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_LaunchConfiguration.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class LaunchConfiguration {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class InstanceMonitoring {
    @JsonProperty("Enabled")
    public boolean enabled;
  }

  @JsonProperty("AssociatePublicIpAddress")
  public boolean associatePublicIpAddress;
  @JacksonXmlElementWrapper(localName = "BlockDeviceMappings")
  @JacksonXmlProperty(localName = "member")
  public List<BlockDeviceMapping> blockDeviceMappings = new ArrayList<>();
  @JsonProperty("CreatedTime")
  public String createdTime;
  @JsonProperty("EbsOptimized")
  public boolean ebsOptimized;
  @JsonProperty("IamInstanceProfile")
  public String iamInstanceProfile;
  @JsonProperty("ImageId")
  public String imageId;
  @JsonProperty("InstanceId")
  public String instanceId;
  @JsonProperty("InstanceMonitoring")
  public InstanceMonitoring instanceMonitoring = new InstanceMonitoring();
  @JsonProperty("InstanceType")
  public String instanceType;
  @JsonProperty("KernelId")
  public String kernelId;
  @JsonProperty("KeyName")
  public String keyName;
  @JsonProperty("LaunchConfigurationARN")
  public String launchConfigurationARN;
  @JsonProperty("LaunchConfigurationName")
  public String launchConfigurationName;
  @JsonProperty("RamdiskId")
  public String ramdiskId;
  @JacksonXmlElementWrapper(localName = "SecurityGroups")
  @JacksonXmlProperty(localName = "member")
  public List<String> securityGroups = new ArrayList<>();
  @JsonProperty("SpotPrice")
  public String spotPrice;
  @JsonProperty("UserData")
  public String userData;

  @Override
  public String toString() {
    return new Gson().toJson(this);
  }
}
