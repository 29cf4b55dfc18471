package io.github.awsbind.autoscaling;

import java.util.*;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.dataformat.xml.annotation.*;
import com.google.gson.Gson;

// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_ScalingPolicy.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScalingPolicy {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Alarm {
    @JsonProperty("AlarmARN")
    public String alarmARN;
    @JsonProperty("AlarmName")
    public String alarmName;
  }

  @JsonProperty("AdjustmentType")
  public String adjustmentType; // ChangeInCapacity, ExactCapacity or PercentChangeInCapacity
  @JacksonXmlElementWrapper(localName = "Alarms")
  @JacksonXmlProperty(localName = "member")
  public List<Alarm> alarms = new ArrayList<>();
  @JsonProperty("AutoScalingGroupName")
  public String autoScalingGroupName;
  @JsonProperty("Cooldown")
  public int cooldown;
  @JsonProperty("MinAdjustmentStep")
  public int minAdjustmentStep;
  @JsonProperty("PolicyARN")
  public String policyARN;
  @JsonProperty("PolicyName")
  public String policyName;
  @JsonProperty("ScalingAdjustment")
  public int scalingAdjustment;

  @Override
  public String toString() {
    return new Gson().toJson(this);
  }
}
