package com.flamingo.ai.factextraction.service.extraction;

/**
 * Removes unpaired UTF-16 surrogates from text before it is sent to the LLM.
 *
 * <p>Lone surrogates come from improperly decoded upstream data and cannot be encoded as UTF-8,
 * which makes the provider reject the whole request. Well-formed surrogate pairs (emoji, rare CJK
 * characters) are kept.
 */
public final class TextSanitizer {

  private TextSanitizer() {}

  public static String removeUnpairedSurrogates(String text) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    StringBuilder sb = null;
    int length = text.length();
    for (int i = 0; i < length; i++) {
      char c = text.charAt(i);
      boolean keep;
      if (Character.isHighSurrogate(c)) {
        keep = i + 1 < length && Character.isLowSurrogate(text.charAt(i + 1));
        if (keep) {
          if (sb != null) {
            sb.append(c).append(text.charAt(i + 1));
          }
          i++;
          continue;
        }
      } else {
        keep = !Character.isLowSurrogate(c);
      }

      if (!keep && sb == null) {
        sb = new StringBuilder(length);
        sb.append(text, 0, i);
      } else if (keep && sb != null) {
        sb.append(c);
      }
    }
    return sb != null ? sb.toString() : text;
  }
}
