package io.github.awsbind.autoscaling;

import com.fasterxml.jackson.annotation.*;
import com.google.common.base.Strings;

// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_BlockDeviceMapping.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlockDeviceMapping {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Ebs {
    @JsonProperty("DeleteOnTermination")
    public boolean deleteOnTermination;
    @JsonProperty("Iops")
    public int iops;
    @JsonProperty("SnapshotId")
    public String snapshotId;
    @JsonProperty("VolumeSize")
    public int volumeSize; // gigabytes
    @JsonProperty("VolumeType")
    public String volumeType;

    boolean isEmpty() {
      return !deleteOnTermination && iops == 0 && Strings.isNullOrEmpty(snapshotId) && volumeSize == 0 && Strings.isNullOrEmpty(volumeType);
    }
  }

  @JsonProperty("DeviceName")
  public String deviceName;
  @JsonProperty("VirtualName")
  public String virtualName;
  @JsonProperty("NoDevice")
  public boolean noDevice;
  @JsonProperty("Ebs")
  public Ebs ebs = new Ebs();

}
