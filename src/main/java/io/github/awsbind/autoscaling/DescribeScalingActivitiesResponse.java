package io.github.awsbind.autoscaling;

import java.util.*;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.dataformat.xml.annotation.*;

// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_DescribeScalingActivities.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class DescribeScalingActivitiesResponse extends GenericResponse {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Result {
    @JacksonXmlElementWrapper(localName = "Activities")
    @JacksonXmlProperty(localName = "member")
    public List<Activity> activities = new ArrayList<>();
    // null on the last page
    @JsonProperty("NextToken")
    public String nextToken;
  }

  @JsonProperty("DescribeScalingActivitiesResult")
  public Result result = new Result();

  @JsonIgnore
  public List<Activity> getActivities() {
    return result.activities == null ? Collections.emptyList() : result.activities;
  }

  @JsonIgnore
  public String getNextToken() {
    return result.nextToken;
  }

}
