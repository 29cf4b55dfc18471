package io.github.awsbind;

import com.google.gson.Gson;

public class CliOptions {
  public boolean help;
  public boolean version;
  public String toString() {
    return new Gson().toJson(this);
  }
}
