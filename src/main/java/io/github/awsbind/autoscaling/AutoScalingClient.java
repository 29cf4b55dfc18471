package io.github.awsbind.autoscaling;

import java.util.*;

import com.google.common.base.Strings;
import com.google.common.io.BaseEncoding;

import helpers.LogHelper;
import io.github.awsbind.transport.*;

/**
 * AutoScalingClient
 *
 * <p>typed options to query parameters, xml response to typed result
 * <p>describe calls page with maxRecords (0 for the service default) and nextToken (empty for the first page)
 */
// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/Welcome.html
public class AutoScalingClient extends XmlQueryClient {

  public static final String API_VERSION = "2011-01-01";

  public static final String RESOURCE_TYPE = "auto-scaling-group";

  public AutoScalingClient(QueryTransport transport) {
    super(transport, API_VERSION);
    debug("ctor", transport);
  }

  // ----------------------------------------------------------------------
  // groups

  public GenericResponse createAutoScalingGroup(CreateAutoScalingGroupOptions options) {
    Map<String, String> params = makeParams("CreateAutoScalingGroup");
    params.put("AutoScalingGroupName", options.autoScalingGroupName);
    putList(params, "AvailabilityZones", options.availabilityZones);
    putInt(params, "DefaultCooldown", options.defaultCooldown);
    params.put("DesiredCapacity", String.valueOf(options.desiredCapacity));
    putInt(params, "HealthCheckGracePeriod", options.healthCheckGracePeriod);
    putString(params, "HealthCheckType", options.healthCheckType);
    putString(params, "InstanceId", options.instanceId);
    putString(params, "LaunchConfigurationName", options.launchConfigurationName);
    putList(params, "LoadBalancerNames", options.loadBalancerNames);
    params.put("MaxSize", String.valueOf(options.maxSize));
    params.put("MinSize", String.valueOf(options.minSize));
    putString(params, "PlacementGroup", options.placementGroup);
    putTags(params, options.tags);
    putList(params, "TerminationPolicies", options.terminationPolicies);
    putString(params, "VPCZoneIdentifier", options.vpcZoneIdentifier);
    return query(params, GenericResponse.class);
  }

  public GenericResponse updateAutoScalingGroup(UpdateAutoScalingGroupOptions options) {
    Map<String, String> params = makeParams("UpdateAutoScalingGroup");
    params.put("AutoScalingGroupName", options.autoScalingGroupName);
    putList(params, "AvailabilityZones", options.availabilityZones);
    putInt(params, "DefaultCooldown", options.defaultCooldown);
    params.put("DesiredCapacity", String.valueOf(options.desiredCapacity));
    putInt(params, "HealthCheckGracePeriod", options.healthCheckGracePeriod);
    putString(params, "HealthCheckType", options.healthCheckType);
    putString(params, "LaunchConfigurationName", options.launchConfigurationName);
    params.put("MaxSize", String.valueOf(options.maxSize));
    params.put("MinSize", String.valueOf(options.minSize));
    putString(params, "PlacementGroup", options.placementGroup);
    putList(params, "TerminationPolicies", options.terminationPolicies);
    putString(params, "VPCZoneIdentifier", options.vpcZoneIdentifier);
    return query(params, GenericResponse.class);
  }

  /**
   * deleteAutoScalingGroup
   *
   * @param forceDelete also terminate the group's instances
   */
  public GenericResponse deleteAutoScalingGroup(String name, boolean forceDelete) {
    Map<String, String> params = makeParams("DeleteAutoScalingGroup");
    params.put("AutoScalingGroupName", name);
    putTrue(params, "ForceDelete", forceDelete);
    return query(params, GenericResponse.class);
  }

  public DescribeAutoScalingGroupsResponse describeAutoScalingGroups(List<String> names, int maxRecords, String nextToken) {
    Map<String, String> params = makeParams("DescribeAutoScalingGroups");
    putList(params, "AutoScalingGroupNames", names);
    putPage(params, maxRecords, nextToken);
    return query(params, DescribeAutoScalingGroupsResponse.class);
  }

  public GenericResponse setDesiredCapacity(String name, int desiredCapacity, boolean honorCooldown) {
    Map<String, String> params = makeParams("SetDesiredCapacity");
    params.put("AutoScalingGroupName", name);
    params.put("DesiredCapacity", String.valueOf(desiredCapacity));
    putTrue(params, "HonorCooldown", honorCooldown);
    return query(params, GenericResponse.class);
  }

  // e.g., Launch, Terminate, HealthCheck, AZRebalance; empty for all
  public GenericResponse suspendProcesses(String name, List<String> scalingProcesses) {
    Map<String, String> params = makeParams("SuspendProcesses");
    params.put("AutoScalingGroupName", name);
    putList(params, "ScalingProcesses", scalingProcesses);
    return query(params, GenericResponse.class);
  }

  public GenericResponse resumeProcesses(String name, List<String> scalingProcesses) {
    Map<String, String> params = makeParams("ResumeProcesses");
    params.put("AutoScalingGroupName", name);
    putList(params, "ScalingProcesses", scalingProcesses);
    return query(params, GenericResponse.class);
  }

  /**
   * createOrUpdateTags
   *
   * <p>resourceId is the group name; resourceType defaults to auto-scaling-group
   */
  public GenericResponse createOrUpdateTags(List<Tag> tags) {
    Map<String, String> params = makeParams("CreateOrUpdateTags");
    for (int i = 0; i < tags.size(); ++i) {
      Tag tag = tags.get(i);
      String prefix = member("Tags", i);
      putString(params, prefix + ".ResourceId", tag.resourceId);
      params.put(prefix + ".ResourceType", Strings.isNullOrEmpty(tag.resourceType) ? RESOURCE_TYPE : tag.resourceType);
      params.put(prefix + ".Key", tag.key);
      putString(params, prefix + ".Value", tag.value);
      params.put(prefix + ".PropagateAtLaunch", String.valueOf(tag.propagateAtLaunch));
    }
    return query(params, GenericResponse.class);
  }

  // ----------------------------------------------------------------------
  // instances

  public GenericResponse attachInstances(String name, List<String> instanceIds) {
    Map<String, String> params = makeParams("AttachInstances");
    params.put("AutoScalingGroupName", name);
    putList(params, "InstanceIds", instanceIds);
    return query(params, GenericResponse.class);
  }

  public DescribeAutoScalingInstancesResponse describeAutoScalingInstances(List<String> instanceIds, int maxRecords, String nextToken) {
    Map<String, String> params = makeParams("DescribeAutoScalingInstances");
    putList(params, "InstanceIds", instanceIds);
    putPage(params, maxRecords, nextToken);
    return query(params, DescribeAutoScalingInstancesResponse.class);
  }

  /**
   * setInstanceHealth
   *
   * @param healthStatus Healthy or Unhealthy
   */
  public GenericResponse setInstanceHealth(String instanceId, String healthStatus, boolean shouldRespectGracePeriod) {
    Map<String, String> params = makeParams("SetInstanceHealth");
    params.put("InstanceId", instanceId);
    params.put("HealthStatus", healthStatus);
    // the service respects the grace period unless told otherwise
    if (!shouldRespectGracePeriod)
      params.put("ShouldRespectGracePeriod", "false");
    return query(params, GenericResponse.class);
  }

  public TerminateInstanceInAutoScalingGroupResponse terminateInstanceInAutoScalingGroup(String instanceId, boolean shouldDecrementDesiredCapacity) {
    Map<String, String> params = makeParams("TerminateInstanceInAutoScalingGroup");
    params.put("InstanceId", instanceId);
    params.put("ShouldDecrementDesiredCapacity", String.valueOf(shouldDecrementDesiredCapacity));
    return query(params, TerminateInstanceInAutoScalingGroupResponse.class);
  }

  // ----------------------------------------------------------------------
  // launch configurations

  public GenericResponse createLaunchConfiguration(CreateLaunchConfigurationOptions options) {
    Map<String, String> params = makeParams("CreateLaunchConfiguration");
    putTrue(params, "AssociatePublicIpAddress", options.associatePublicIpAddress);
    for (int i = 0; i < options.blockDeviceMappings.size(); ++i) {
      BlockDeviceMapping mapping = options.blockDeviceMappings.get(i);
      String prefix = member("BlockDeviceMappings", i);
      params.put(prefix + ".DeviceName", mapping.deviceName);
      putString(params, prefix + ".VirtualName", mapping.virtualName);
      putTrue(params, prefix + ".NoDevice", mapping.noDevice);
      if (mapping.ebs != null && !mapping.ebs.isEmpty()) {
        params.put(prefix + ".Ebs.DeleteOnTermination", String.valueOf(mapping.ebs.deleteOnTermination));
        putInt(params, prefix + ".Ebs.Iops", mapping.ebs.iops);
        putString(params, prefix + ".Ebs.SnapshotId", mapping.ebs.snapshotId);
        putInt(params, prefix + ".Ebs.VolumeSize", mapping.ebs.volumeSize);
        putString(params, prefix + ".Ebs.VolumeType", mapping.ebs.volumeType);
      }
    }
    putTrue(params, "EbsOptimized", options.ebsOptimized);
    putString(params, "IamInstanceProfile", options.iamInstanceProfile);
    putString(params, "ImageId", options.imageId);
    putString(params, "InstanceId", options.instanceId);
    putTrue(params, "InstanceMonitoring.Enabled", options.instanceMonitoring);
    putString(params, "InstanceType", options.instanceType);
    putString(params, "KernelId", options.kernelId);
    putString(params, "KeyName", options.keyName);
    params.put("LaunchConfigurationName", options.launchConfigurationName);
    putString(params, "RamdiskId", options.ramdiskId);
    putList(params, "SecurityGroups", options.securityGroups);
    putString(params, "SpotPrice", options.spotPrice);
    if (options.userData != null && options.userData.length > 0)
      params.put("UserData", BaseEncoding.base64().encode(options.userData));
    return query(params, GenericResponse.class);
  }

  public GenericResponse deleteLaunchConfiguration(String name) {
    Map<String, String> params = makeParams("DeleteLaunchConfiguration");
    params.put("LaunchConfigurationName", name);
    return query(params, GenericResponse.class);
  }

  public DescribeLaunchConfigurationsResponse describeLaunchConfigurations(List<String> names, int maxRecords, String nextToken) {
    Map<String, String> params = makeParams("DescribeLaunchConfigurations");
    putList(params, "LaunchConfigurationNames", names);
    putPage(params, maxRecords, nextToken);
    return query(params, DescribeLaunchConfigurationsResponse.class);
  }

  // ----------------------------------------------------------------------
  // policies and activities

  /**
   * putScalingPolicy
   *
   * <p>creates or replaces the named policy
   */
  public PutScalingPolicyResponse putScalingPolicy(ScalingPolicy policy) {
    Map<String, String> params = makeParams("PutScalingPolicy");
    params.put("AutoScalingGroupName", policy.autoScalingGroupName);
    params.put("PolicyName", policy.policyName);
    params.put("ScalingAdjustment", String.valueOf(policy.scalingAdjustment));
    params.put("AdjustmentType", policy.adjustmentType);
    putInt(params, "Cooldown", policy.cooldown);
    putInt(params, "MinAdjustmentStep", policy.minAdjustmentStep);
    return query(params, PutScalingPolicyResponse.class);
  }

  /**
   * executePolicy
   *
   * @param name policy name or arn
   * @param autoScalingGroupName empty when name is an arn
   */
  public GenericResponse executePolicy(String name, String autoScalingGroupName, boolean honorCooldown) {
    Map<String, String> params = makeParams("ExecutePolicy");
    params.put("PolicyName", name);
    putString(params, "AutoScalingGroupName", autoScalingGroupName);
    putTrue(params, "HonorCooldown", honorCooldown);
    return query(params, GenericResponse.class);
  }

  public DescribePoliciesResponse describePolicies(String autoScalingGroupName, List<String> policyNames, int maxRecords, String nextToken) {
    Map<String, String> params = makeParams("DescribePolicies");
    putString(params, "AutoScalingGroupName", autoScalingGroupName);
    putList(params, "PolicyNames", policyNames);
    putPage(params, maxRecords, nextToken);
    return query(params, DescribePoliciesResponse.class);
  }

  public DescribeScalingActivitiesResponse describeScalingActivities(String autoScalingGroupName, List<String> activityIds, int maxRecords, String nextToken) {
    Map<String, String> params = makeParams("DescribeScalingActivities");
    putString(params, "AutoScalingGroupName", autoScalingGroupName);
    putList(params, "ActivityIds", activityIds);
    putPage(params, maxRecords, nextToken);
    return query(params, DescribeScalingActivitiesResponse.class);
  }

  private static void putPage(Map<String, String> params, int maxRecords, String nextToken) {
    putInt(params, "MaxRecords", maxRecords);
    putString(params, "NextToken", nextToken);
  }

  private static void putTags(Map<String, String> params, List<Tag> tags) {
    for (int i = 0; i < tags.size(); ++i) {
      Tag tag = tags.get(i);
      String prefix = member("Tags", i);
      params.put(prefix + ".Key", tag.key);
      putString(params, prefix + ".Value", tag.value);
      params.put(prefix + ".PropagateAtLaunch", String.valueOf(tag.propagateAtLaunch));
    }
  }

  private void debug(Object... args) {
    new LogHelper(this).debug(args);
  }

}
