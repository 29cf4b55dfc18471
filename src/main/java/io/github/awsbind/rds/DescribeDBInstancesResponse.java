package io.github.awsbind.rds;

import java.util.*;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.dataformat.xml.annotation.*;

// https://docs.aws.amazon.com/AmazonRDS/latest/APIReference/API_DescribeDBInstances.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class DescribeDBInstancesResponse {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Result {
    @JacksonXmlElementWrapper(localName = "DBInstances")
    @JacksonXmlProperty(localName = "DBInstance")
    public List<DBInstance> dbInstances = new ArrayList<>();
    // pagination token for the next call, null on the last page
    @JsonProperty("Marker")
    public String marker;
  }

  @JsonProperty("DescribeDBInstancesResult")
  public Result result = new Result();
  @JsonProperty("ResponseMetadata")
  public ResponseMetadata responseMetadata = new ResponseMetadata();

  @JsonIgnore
  public List<DBInstance> getDBInstances() {
    return result.dbInstances == null ? Collections.emptyList() : result.dbInstances;
  }

  @JsonIgnore
  public String getMarker() {
    return result.marker;
  }

  @JsonIgnore
  public String getRequestId() {
    return responseMetadata.requestId;
  }

}
