package io.github.awsbind;

import static org.assertj.core.api.Assertions.*;

import com.google.gson.*;

import org.junit.jupiter.api.*;
import org.springframework.boot.DefaultApplicationArguments;

import helpers.LogHelper;
import io.github.awsbind.transport.AwsOptions;

public class ArgsTest {

  static class Options {
    String foo;
    boolean bar1;
    boolean bar2;
    boolean bar3;
    int baz0;
    int baz1;
    public String toString() {
      return new Gson().toJson(this);
    }
  }

  @Test
  public void optionsTest() {

    Options options = Args.options("basepart,foo=abc,bar1,bar2=true,bar3=false,baz1=1", Options.class);

    log(options);

    assertThat(options.foo).isEqualTo("abc");
    assertThat(options.bar1).isTrue();
    assertThat(options.bar2).isTrue();
    assertThat(options.bar3).isFalse();

    assertThat(options.baz0).isEqualTo(0);
    assertThat(options.baz1).isEqualTo(1);

  }

  @Test
  public void baseTest() {
    assertThat(Args.base("dynamo:MyTable")).isEqualTo("dynamo:MyTable");
    assertThat(Args.base("dynamo:MyTable,region=us-west-2")).isEqualTo("dynamo:MyTable");
  }

  @Test
  public void awsOptionsTest() {
    AwsOptions options = Args.options("dynamo:MyTable,endpoint=http://localhost:8000,region=us-west-2,profile=dev", AwsOptions.class);
    assertThat(options.endpoint).isEqualTo("http://localhost:8000");
    assertThat(options.region).isEqualTo("us-west-2");
    assertThat(options.profile).isEqualTo("dev");
    assertThat(options.accessKey).isNull();
  }

  @Test
  public void noOptionsTest() {
    AwsOptions options = Args.options("dynamo:MyTable", AwsOptions.class);
    assertThat(options.endpoint).isNull();
    assertThat(options.region).isNull();
  }

  @Test
  public void parseOptionsTest() {
    CliOptions options = Args.parseOptions(new DefaultApplicationArguments("--help", "put", "dynamo:MyTable"), CliOptions.class);
    assertThat(options.help).isTrue();
    assertThat(options.version).isFalse();
  }

  @Test
  public void tableNameTest() {
    assertThat(Main.tableName("dynamo:MyTable,region=us-west-2")).isEqualTo("MyTable");
    assertThat(Main.tableName("dynamodb:MyTable")).isEqualTo("MyTable");
    assertThat(Main.tableName("dynamo:")).isEmpty();
    assertThat(Main.tableName("dynamo")).isEmpty();
  }

  private void log(Object... args) {
    new LogHelper(this).debug(args);
  }

}
