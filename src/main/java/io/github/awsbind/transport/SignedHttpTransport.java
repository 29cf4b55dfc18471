package io.github.awsbind.transport;

import java.io.*;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

import com.google.common.base.*;
import com.google.common.collect.Iterables;
import com.google.common.io.ByteStreams;
import com.google.common.net.UrlEscapers;

import helpers.LogHelper;
import io.github.awsbind.TransportException;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.signer.Aws4Signer;
import software.amazon.awssdk.auth.signer.params.Aws4SignerParams;
import software.amazon.awssdk.http.*;
import software.amazon.awssdk.regions.Region;

/**
 * SignedHttpTransport
 *
 * <p>one sigv4-signed POST per call; no retries, no backoff
 * <p>thread-safe as long as the underlying http client is
 */
public class SignedHttpTransport implements Transport, QueryTransport, AutoCloseable {

  private static final String JSON_CONTENT_TYPE = "application/x-amz-json-1.0";
  private static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded; charset=utf-8";

  private final String signingName;
  private final URI endpoint;
  private final Region region;
  private final AwsCredentialsProvider credentialsProvider;
  private final SdkHttpClient httpClient;
  private final Aws4Signer signer = Aws4Signer.create();

  public SignedHttpTransport(String signingName, URI endpoint, Region region, AwsCredentialsProvider credentialsProvider, SdkHttpClient httpClient) {
    debug("ctor", signingName, endpoint, region);
    this.signingName = Preconditions.checkNotNull(signingName, "signingName");
    this.endpoint = Preconditions.checkNotNull(endpoint, "endpoint");
    this.region = Preconditions.checkNotNull(region, "region");
    this.credentialsProvider = Preconditions.checkNotNull(credentialsProvider, "credentialsProvider");
    this.httpClient = Preconditions.checkNotNull(httpClient, "httpClient");
  }

  public String getSigningName() {
    return signingName;
  }

  public URI getEndpoint() {
    return endpoint;
  }

  public Region getRegion() {
    return region;
  }

  // https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Programming.LowLevelAPI.html
  @Override
  public byte[] send(String target, String payload) throws TransportException {
    debug("send", target);
    trace("send", target, payload);
    SdkHttpFullRequest.Builder request = post(payload.getBytes(StandardCharsets.UTF_8), JSON_CONTENT_TYPE);
    request.putHeader("X-Amz-Target", target);
    return execute(request.build());
  }

  // https://docs.aws.amazon.com/AmazonRDS/latest/APIReference/CommonParameters.html
  @Override
  public byte[] query(Map<String, String> params) throws TransportException {
    debug("query", params.get("Action"));
    String body = Joiner.on("&").join(Iterables.transform(new TreeMap<>(params).entrySet(), SignedHttpTransport::formPair));
    trace("query", body);
    return execute(post(body.getBytes(StandardCharsets.UTF_8), FORM_CONTENT_TYPE).build());
  }

  private static String formPair(Entry<String, String> entry) {
    return UrlEscapers.urlFormParameterEscaper().escape(entry.getKey()) + "=" + UrlEscapers.urlFormParameterEscaper().escape(entry.getValue());
  }

  private SdkHttpFullRequest.Builder post(byte[] body, String contentType) {
    return SdkHttpFullRequest.builder()
        //
        .method(SdkHttpMethod.POST)
        //
        .uri(endpoint.getPath().isEmpty() ? endpoint.resolve("/") : endpoint)
        //
        .putHeader("Content-Type", contentType)
        //
        .putHeader("Content-Length", String.valueOf(body.length))
        //
        .contentStreamProvider(() -> new ByteArrayInputStream(body));
  }

  private byte[] execute(SdkHttpFullRequest request) throws TransportException {
    Aws4SignerParams params = Aws4SignerParams.builder()
        //
        .awsCredentials(credentialsProvider.resolveCredentials())
        //
        .signingName(signingName)
        //
        .signingRegion(region)
        //
        .build();
    SdkHttpFullRequest signed = signer.sign(request, params);
    try {
      HttpExecuteResponse response = httpClient.prepareRequest(HttpExecuteRequest.builder()
          //
          .request(signed)
          //
          .contentStreamProvider(signed.contentStreamProvider().orElse(null))
          //
          .build()).call();
      byte[] body = new byte[0];
      if (response.responseBody().isPresent()) {
        try (InputStream in = response.responseBody().get()) {
          body = ByteStreams.toByteArray(in);
        }
      }
      int statusCode = response.httpResponse().statusCode();
      trace("execute", statusCode, new String(body, StandardCharsets.UTF_8));
      if (!response.httpResponse().isSuccessful())
        throw new TransportException(statusCode, new String(body, StandardCharsets.UTF_8));
      return body;
    } catch (IOException e) {
      throw new TransportException(endpoint + " " + e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    httpClient.close();
  }

  public String toString() {
    return MoreObjects.toStringHelper(this)
        //
        .add("signingName", signingName).add("endpoint", endpoint).add("region", region).toString();
  }

  private void debug(Object... args) {
    new LogHelper(this).debug(args);
  }

  private void trace(Object... args) {
    new LogHelper(this).trace(args);
  }

}
