package kala;

import java.util.ArrayList;

public enum EnvVar {
  KALA_STRICT("Set to \"1\" to abort on mismatched braces, as --strict does."),
  KALA_FILENAME("File name for the .file directive of the generated assembly.");

  public final String description;

  EnvVar(String description) {
    this.description = description;
  }

  public String value() {
    if (isAvailable()) {
      return getValue();
    }
    return "";
  }

  public boolean isSetToOne() {
    return isAvailable() && isSetToValue("1");
  }

  public boolean isSetToValue(String varValue) {
    String value = getValue();
    return value != null && value.equals(varValue);
  }

  private String getValue() {
    return System.getenv(this.name());
  }

  public boolean isAvailable() {
    return System.getenv().containsKey(this.name());
  }

  public static String[] getAllEnvVarDescriptions() {
    ArrayList<String> descriptions = new ArrayList<String>();
    for (EnvVar envVariable : EnvVar.values()) {
      descriptions.add("  " + envVariable.name() + ": " + envVariable.description);
    }
    return descriptions.toArray(new String[0]);
  }
}
