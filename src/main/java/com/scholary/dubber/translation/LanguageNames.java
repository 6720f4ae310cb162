package com.scholary.dubber.translation;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/** Human-readable language names for prompts. Unknown codes are returned unchanged. */
public final class LanguageNames {

  /**
   * Accepted shape of a language code: a two or three letter primary tag with optional subtags,
   * such as {@code en}, {@code zh-TW} or {@code pt-BR}.
   *
   * <p>Why so strict? Because the code is used as a path segment for scratch and output
   * directories, so anything that could be read as a separator or {@code ..} must never get
   * through.
   */
  public static final String CODE_PATTERN = "[A-Za-z]{2,3}(-[A-Za-z0-9]{2,8})*";

  private static final Pattern CODE = Pattern.compile(CODE_PATTERN);

  private static final Map<String, String> NAMES =
      Map.ofEntries(
          Map.entry("en", "English"),
          Map.entry("es", "Spanish"),
          Map.entry("fr", "French"),
          Map.entry("de", "German"),
          Map.entry("it", "Italian"),
          Map.entry("pt", "Portuguese"),
          Map.entry("ja", "Japanese"),
          Map.entry("ko", "Korean"),
          Map.entry("zh", "Chinese"),
          Map.entry("zh-cn", "Chinese (Simplified)"),
          Map.entry("zh-tw", "Chinese (Traditional)"),
          Map.entry("ru", "Russian"),
          Map.entry("ar", "Arabic"),
          Map.entry("hi", "Hindi"));

  private LanguageNames() {}

  /** Whether {@code code} has the shape of a language code. */
  public static boolean isValidCode(String code) {
    return code != null && CODE.matcher(code).matches();
  }

  public static String nameOf(String code) {
    if (code == null) {
      return "";
    }
    String key = code.toLowerCase(Locale.ROOT);
    String name = NAMES.get(key);
    if (name == null && key.indexOf('-') > 0) {
      name = NAMES.get(key.substring(0, key.indexOf('-')));
    }
    return name == null ? code : name;
  }
}
