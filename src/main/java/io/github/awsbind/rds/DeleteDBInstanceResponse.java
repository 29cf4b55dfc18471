package io.github.awsbind.rds;

import com.fasterxml.jackson.annotation.*;

// https://docs.aws.amazon.com/AmazonRDS/latest/APIReference/API_DeleteDBInstance.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeleteDBInstanceResponse {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Result {
    @JsonProperty("DBInstance")
    public DBInstance dbInstance;
  }

  @JsonProperty("DeleteDBInstanceResult")
  public Result result = new Result();
  @JsonProperty("ResponseMetadata")
  public ResponseMetadata responseMetadata = new ResponseMetadata();

  @JsonIgnore
  public DBInstance getDBInstance() {
    return result.dbInstance;
  }

  @JsonIgnore
  public String getRequestId() {
    return responseMetadata.requestId;
  }

}
