package io.github.awsbind.autoscaling;

import java.util.*;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.dataformat.xml.annotation.*;
import com.google.gson.Gson;

/**
 * AutoScalingGroup
 */
// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_AutoScalingGroup.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class AutoScalingGroup {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class EnabledMetric {
    @JsonProperty("Granularity")
    public String granularity;
    @JsonProperty("Metric")
    public String metric;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SuspendedProcess {
    @JsonProperty("ProcessName")
    public String processName;
    @JsonProperty("SuspensionReason")
    public String suspensionReason;
  }

  @JsonProperty("AutoScalingGroupARN")
  public String autoScalingGroupARN;
  @JsonProperty("AutoScalingGroupName")
  public String autoScalingGroupName;
  @JacksonXmlElementWrapper(localName = "AvailabilityZones")
  @JacksonXmlProperty(localName = "member")
  public List<String> availabilityZones = new ArrayList<>();
  @JsonProperty("CreatedTime")
  public String createdTime;
  @JsonProperty("DefaultCooldown")
  public int defaultCooldown; // seconds
  @JsonProperty("DesiredCapacity")
  public int desiredCapacity;
  @JacksonXmlElementWrapper(localName = "EnabledMetrics")
  @JacksonXmlProperty(localName = "member")
  public List<EnabledMetric> enabledMetrics = new ArrayList<>();
  @JsonProperty("HealthCheckGracePeriod")
  public int healthCheckGracePeriod; // seconds
  @JsonProperty("HealthCheckType")
  public String healthCheckType;
  @JacksonXmlElementWrapper(localName = "Instances")
  @JacksonXmlProperty(localName = "member")
  public List<Instance> instances = new ArrayList<>();
  @JsonProperty("LaunchConfigurationName")
  public String launchConfigurationName;
  @JacksonXmlElementWrapper(localName = "LoadBalancerNames")
  @JacksonXmlProperty(localName = "member")
  public List<String> loadBalancerNames = new ArrayList<>();
  @JsonProperty("MaxSize")
  public int maxSize;
  @JsonProperty("MinSize")
  public int minSize;
  @JsonProperty("PlacementGroup")
  public String placementGroup;
  @JsonProperty("Status")
  public String status; // set while a delete is in progress
  @JacksonXmlElementWrapper(localName = "SuspendedProcesses")
  @JacksonXmlProperty(localName = "member")
  public List<SuspendedProcess> suspendedProcesses = new ArrayList<>();
  @JacksonXmlElementWrapper(localName = "Tags")
  @JacksonXmlProperty(localName = "member")
  public List<Tag> tags = new ArrayList<>();
  @JacksonXmlElementWrapper(localName = "TerminationPolicies")
  @JacksonXmlProperty(localName = "member")
  public List<String> terminationPolicies = new ArrayList<>();
  @JsonProperty("VPCZoneIdentifier")
  public String vpcZoneIdentifier;

  @Override
  public String toString() {
    return new Gson().toJson(this);
  }
}
