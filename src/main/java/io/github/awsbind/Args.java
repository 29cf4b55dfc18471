package io.github.awsbind;

import java.util.HashMap;

import com.google.common.base.Splitter;
import com.google.gson.Gson;

import org.springframework.boot.ApplicationArguments;

// dynamo:MyTable,endpoint=http://localhost:8000,region=us-east-1
public class Args {

  /**
   * base
   * 
   * @param arg e.g., "dynamo:MyTable,endpoint=http://localhost:8000"
   * @return e.g., "dynamo:MyTable"
   */
  public static String base(String arg) {
    int index = arg.indexOf(",");
    if (index != -1)
      arg = arg.substring(0, index);
    return arg;
  }

  /**
   * options
   * 
   * @param arg e.g., "dynamo:MyTable,endpoint=http://localhost:8000"
   * @param classOfT plain options class with public fields
   * @return the k=v pairs after the first comma, mapped onto classOfT
   */
  public static <T> T options(String arg, Class<T> classOfT) {
    var options = new HashMap<String, String>();
    int index = arg.indexOf(",");
    if (index != -1) {
      for (String part : Splitter.on(",").trimResults().omitEmptyStrings().split(arg.substring(index + 1))) {
        int eq = part.indexOf("=");
        // bare flag, e.g., "help"
        if (eq == -1)
          options.put(part, "true");
        else
          options.put(part.substring(0, eq), part.substring(eq + 1));
      }
    }
    return new Gson().fromJson(new Gson().toJson(options), classOfT);
  }

  /**
   * parseOptions
   * 
   * @param args e.g., --help
   * @param classOfT plain options class with public fields
   * @return the --option args mapped onto classOfT
   */
  public static <T> T parseOptions(ApplicationArguments args, Class<T> classOfT) {
    var options = new HashMap<String, String>();
    for (String name : args.getOptionNames()) {
      var values = args.getOptionValues(name);
      options.put(name, values == null || values.isEmpty() ? "true" : values.get(values.size() - 1));
    }
    return new Gson().fromJson(new Gson().toJson(options), classOfT);
  }

}
