package io.github.awsbind.autoscaling;

import java.util.*;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.dataformat.xml.annotation.*;

// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_DescribeAutoScalingInstances.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class DescribeAutoScalingInstancesResponse extends GenericResponse {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Result {
    @JacksonXmlElementWrapper(localName = "AutoScalingInstances")
    @JacksonXmlProperty(localName = "member")
    public List<Instance> autoScalingInstances = new ArrayList<>();
    // null on the last page
    @JsonProperty("NextToken")
    public String nextToken;
  }

  @JsonProperty("DescribeAutoScalingInstancesResult")
  public Result result = new Result();

  @JsonIgnore
  public List<Instance> getAutoScalingInstances() {
    return result.autoScalingInstances == null ? Collections.emptyList() : result.autoScalingInstances;
  }

  @JsonIgnore
  public String getNextToken() {
    return result.nextToken;
  }

}
