package io.github.awsbind.autoscaling;

import java.util.*;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.dataformat.xml.annotation.*;

// https://docs.aws.amazon.com/autoscaling/ec2/APIReference/API_DescribeLaunchConfigurations.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class DescribeLaunchConfigurationsResponse extends GenericResponse {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Result {
    @JacksonXmlElementWrapper(localName = "LaunchConfigurations")
    @JacksonXmlProperty(localName = "member")
    public List<LaunchConfiguration> launchConfigurations = new ArrayList<>();
    // null on the last page
    @JsonProperty("NextToken")
    public String nextToken;
  }

  @JsonProperty("DescribeLaunchConfigurationsResult")
  public Result result = new Result();

  @JsonIgnore
  public List<LaunchConfiguration> getLaunchConfigurations() {
    return result.launchConfigurations == null ? Collections.emptyList() : result.launchConfigurations;
  }

  @JsonIgnore
  public String getNextToken() {
    return result.nextToken;
  }

}
