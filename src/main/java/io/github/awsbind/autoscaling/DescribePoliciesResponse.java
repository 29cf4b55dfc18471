package io.github.awsbind.autoscaling;

import java.util.*;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.dataformat.xml.annotation.*;

// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_DescribePolicies.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class DescribePoliciesResponse extends GenericResponse {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Result {
    @JacksonXmlElementWrapper(localName = "ScalingPolicies")
    @JacksonXmlProperty(localName = "member")
    public List<ScalingPolicy> scalingPolicies = new ArrayList<>();
    // null on the last page
    @JsonProperty("NextToken")
    public String nextToken;
  }

  @JsonProperty("DescribePoliciesResult")
  public Result result = new Result();

  @JsonIgnore
  public List<ScalingPolicy> getScalingPolicies() {
    return result.scalingPolicies == null ? Collections.emptyList() : result.scalingPolicies;
  }

  @JsonIgnore
  public String getNextToken() {
    return result.nextToken;
  }

}
