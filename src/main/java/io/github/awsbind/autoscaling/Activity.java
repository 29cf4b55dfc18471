package io.github.awsbind.autoscaling;

import com.fasterxml.jackson.annotation.*;
import com.google.gson.Gson;

/**
 * Activity
 *
 * <p>one scaling activity; statusCode moves through e.g. InProgress to Successful or Failed
 */
// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_Activity.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class Activity {
  @JsonProperty("ActivityId")
  public String activityId;
  @JsonProperty("AutoScalingGroupName")
  public String autoScalingGroupName;
  @JsonProperty("Cause")
  public String cause;
  @JsonProperty("Description")
  public String description;
  @JsonProperty("Details")
  public String details;
  @JsonProperty("EndTime")
  public String endTime;
  @JsonProperty("Progress")
  public int progress; // percent
  @JsonProperty("StartTime")
  public String startTime;
  @JsonProperty("StatusCode")
  public String statusCode;
  @JsonProperty("StatusMessage")
  public String statusMessage;

  @Override
  public String toString() {
    return new Gson().toJson(this);
  }
}
