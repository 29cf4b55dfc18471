package io.github.awsbind.transport;

import java.net.*;

import com.google.common.base.*;
import com.google.gson.*;

import helpers.LogHelper;
import software.amazon.awssdk.auth.credentials.*;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.*;

public class AwsHelper {

  /**
   * transport
   * 
   * <p>
   * configure aws endpoint, region and credentials
   * 
   * @param signingName e.g., "dynamodb", "rds"
   * @param options any object carrying {@link AwsOptions} fields
   * @return a signed transport, caller closes
   */
  public static SignedHttpTransport transport(String signingName, Object options) {
    AwsOptions awsOptions = new Gson().fromJson(new Gson().toJson(options), AwsOptions.class);
    debug("transport", signingName, awsOptions);
    Region region = Region.of(Strings.isNullOrEmpty(awsOptions.region) ? "us-east-1" : awsOptions.region);
    URI endpoint = URI.create(String.format("https://%s.%s.amazonaws.com", signingName, region.id()));
    if (!Strings.isNullOrEmpty(awsOptions.endpoint))
      endpoint = URI.create(awsOptions.endpoint);
    return new SignedHttpTransport(signingName, endpoint, region, credentialsProvider(awsOptions), UrlConnectionHttpClient.create());
  }

  static AwsCredentialsProvider credentialsProvider(AwsOptions awsOptions) {
    if (!Strings.isNullOrEmpty(awsOptions.profile))
      return ProfileCredentialsProvider.create(awsOptions.profile);
    if (!Strings.isNullOrEmpty(awsOptions.accessKey) && !Strings.isNullOrEmpty(awsOptions.secretKey))
      return StaticCredentialsProvider.create(AwsBasicCredentials.create(awsOptions.accessKey, awsOptions.secretKey));
    // https://github.com/localstack/localstack/blob/master/README.md#setting-up-local-region-and-credentials-to-run-localstack
    if (!Strings.isNullOrEmpty(awsOptions.endpoint))
      return StaticCredentialsProvider.create(AwsBasicCredentials.create("test", "test"));
    return DefaultCredentialsProvider.create();
  }

  private static void debug(Object... args) {
    new LogHelper(AwsHelper.class).debug(args);
  }

}
