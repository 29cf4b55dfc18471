package io.github.awsbind;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

import com.google.common.collect.*;

import org.springframework.beans.factory.annotation.*;
import org.springframework.boot.*;
import org.springframework.boot.autoconfigure.*;

import helpers.LogHelper;
import io.github.awsbind.dynamodb.Server;
import io.github.awsbind.transport.*;

// https://docs.spring.io/spring-boot/docs/current/reference/htmlsingle
@SpringBootApplication
public class Main implements ApplicationRunner {

  public static void main(String[] args) throws Exception {
    System.exit(SpringApplication.exit(SpringApplication.run(Main.class, args)));
  }

  @Value("${project-version:unknown}")
  private String projectVersion;

  /**
   * run
   */
  @Override
  public void run(ApplicationArguments args) throws Exception {
    CliOptions options = Args.parseOptions(args, CliOptions.class);
    List<String> nonOptionArgs = args.getNonOptionArgs();

    stderr("awsbind.jar", projectVersion, options);

    boolean help = options.help || options.version;
    if (nonOptionArgs.size() != 2)
      help = true;
    else if (!ImmutableSet.of("put", "delete").contains(nonOptionArgs.get(0)))
      help = true;
    else if (!ImmutableSet.of("dynamo", "dynamodb").contains(Args.base(nonOptionArgs.get(1)).split(":")[0]))
      help = true;
    else if (tableName(nonOptionArgs.get(1)).isEmpty())
      help = true;

    if (help) {
      final String indent = "  ";
      stderr("Usage:");
      stderr(indent, "awsbind.jar [options] <put|delete> dynamo:<tableName>[,endpoint,region,profile,accessKey,secretKey]");
      stderr("options:");
      stderr(indent, "--help");
      stderr(indent, "--version");
      stderr("stdin: concatenated dynamodb-json items (keys for delete)");
      stderr("stdout: items that were not written");
      return;
    }

    String address = nonOptionArgs.get(1);
    String tableName = tableName(address);
    AwsOptions awsOptions = Args.options(address, AwsOptions.class);

    try (SignedHttpTransport transport = AwsHelper.transport("dynamodb", awsOptions)) {
      BatchWriteCommand command = new BatchWriteCommand(new Server(transport), tableName, "delete".equals(nonOptionArgs.get(0)), System.out);
      stderr("start", tableName, transport);
      stderr(command.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))));
    }
  }

  // dynamo:MyTable,region=us-west-2 -> MyTable
  static String tableName(String address) {
    String base = Args.base(address);
    int index = base.indexOf(":");
    return index == -1 ? "" : base.substring(index + 1);
  }

  private void stderr(Object... args) {
    System.err.println(new LogHelper(this).str(args));
  }

}
