package io.github.awsbind.autoscaling;

import java.util.*;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.dataformat.xml.annotation.*;

// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_DescribeAutoScalingGroups.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class DescribeAutoScalingGroupsResponse extends GenericResponse {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Result {
    @JacksonXmlElementWrapper(localName = "AutoScalingGroups")
    @JacksonXmlProperty(localName = "member")
    public List<AutoScalingGroup> autoScalingGroups = new ArrayList<>();
    // null on the last page
    @JsonProperty("NextToken")
    public String nextToken;
  }

  @JsonProperty("DescribeAutoScalingGroupsResult")
  public Result result = new Result();

  @JsonIgnore
  public List<AutoScalingGroup> getAutoScalingGroups() {
    return result.autoScalingGroups == null ? Collections.emptyList() : result.autoScalingGroups;
  }

  @JsonIgnore
  public String getNextToken() {
    return result.nextToken;
  }

}
