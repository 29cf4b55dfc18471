package io.github.awsbind.transport;

import com.google.gson.Gson;

/**
 * AwsOptions
 *
 * <p>the aws part of an address, e.g., "dynamo:MyTable,endpoint=http://localhost:8000,region=us-west-2"
 */
public class AwsOptions {
  public String endpoint;
  public String region;
  public String profile;
  public String accessKey;
  public String secretKey;
  public String toString() {
    return new Gson().toJson(this);
  }
}
