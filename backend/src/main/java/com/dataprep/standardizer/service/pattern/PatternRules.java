package com.dataprep.standardizer.service.pattern;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shape predicates and canonical-form rules backing each {@link PatternFamily}. Every rule is a
 * pure function of its (already trimmed) input and falls back to returning the input unchanged
 * when it cannot produce a canonical form.
 */
final class PatternRules {

  private static final Pattern PHONE_SHAPE = Pattern.compile("^[\\d\\s\\-().+]{7,}$");
  private static final Pattern DIGIT_RUN = Pattern.compile("\\d{3,}");
  private static final Pattern EMAIL_SHAPE = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
  private static final Pattern DATE_SHAPE =
      Pattern.compile("^(\\d{1,4})[/\\-.](\\d{1,2})[/\\-.](\\d{1,4})$");
  private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
  private static final Pattern CURRENCY_SHAPE =
      Pattern.compile(
          "^[$€£¥₹]\\s?\\d[\\d,\\s]*(\\.\\d*)?$|^\\d[\\d,\\s]*(\\.\\d*)?\\s?[$€£¥₹]$");
  private static final Pattern NUMERIC_SHAPE = Pattern.compile("^\\d[\\d,\\s]*(\\.\\d+)?$");
  private static final Pattern URL_SHAPE =
      Pattern.compile("^(https?://)?[\\da-z.\\-]+\\.[a-z]{2,6}(/\\S*)?$", Pattern.CASE_INSENSITIVE);
  private static final Pattern CODE_SHAPE = Pattern.compile("^[A-Za-z0-9\\-\\s]{3,}$");
  private static final Pattern NAME_SHAPE = Pattern.compile("^[A-Za-z\\s\\-'.]+$");
  private static final Pattern LETTER = Pattern.compile("[A-Za-z]");
  private static final Pattern DIGIT = Pattern.compile("\\d");
  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

  private static final Set<String> TRUE_TOKENS = Set.of("yes", "y", "true", "1", "on", "enabled");
  private static final Set<String> FALSE_TOKENS =
      Set.of("no", "n", "false", "0", "off", "disabled");

  private PatternRules() {}

  // ---- predicates ----

  static boolean isPhone(String value) {
    // Date-shaped strings (e.g. 2023-01-15) also satisfy the phone character class.
    return PHONE_SHAPE.matcher(value).matches()
        && DIGIT_RUN.matcher(value).find()
        && !DATE_SHAPE.matcher(value).matches();
  }

  static boolean isEmail(String value) {
    return EMAIL_SHAPE.matcher(value).matches();
  }

  static boolean isDate(String value) {
    return DATE_SHAPE.matcher(value).matches() || ISO_DATE.matcher(value).matches();
  }

  static boolean isBoolean(String value) {
    String lowered = value.toLowerCase(Locale.ROOT);
    return TRUE_TOKENS.contains(lowered) || FALSE_TOKENS.contains(lowered);
  }

  static boolean isCurrency(String value) {
    return CURRENCY_SHAPE.matcher(value).matches();
  }

  static boolean isNumericFormatted(String value) {
    return NUMERIC_SHAPE.matcher(value).matches()
        && (value.indexOf(',') >= 0 || WHITESPACE_RUN.matcher(value).find());
  }

  static boolean isUrl(String value) {
    return URL_SHAPE.matcher(value).matches();
  }

  static boolean isCode(String value) {
    return CODE_SHAPE.matcher(value).matches()
        && LETTER.matcher(value).find()
        && DIGIT.matcher(value).find();
  }

  static boolean isName(String value) {
    return value.length() > 2 && NAME_SHAPE.matcher(value).matches();
  }

  // ---- canonical forms ----

  static String canonicalPhone(String value) {
    String digits = value.replaceAll("\\D", "");
    if (digits.length() == 10) {
      return formatNorthAmerican(digits);
    }
    if (digits.length() == 11 && digits.startsWith("1")) {
      return "+1 " + formatNorthAmerican(digits.substring(1));
    }
    return digits;
  }

  private static String formatNorthAmerican(String tenDigits) {
    return String.format(
        "(%s) %s-%s", tenDigits.substring(0, 3), tenDigits.substring(3, 6), tenDigits.substring(6));
  }

  static String canonicalEmail(String value) {
    return value.toLowerCase(Locale.ROOT);
  }

  static String canonicalDate(String value) {
    if (ISO_DATE.matcher(value).matches()) {
      return value;
    }
    Matcher matcher = DATE_SHAPE.matcher(value);
    if (!matcher.matches()) {
      return value;
    }
    String first = matcher.group(1);
    String second = matcher.group(2);
    String third = matcher.group(3);

    if (first.length() == 4) {
      return isoDate(first, Integer.parseInt(second), Integer.parseInt(third), value);
    }
    if (third.length() == 4) {
      int leading = Integer.parseInt(first);
      int middle = Integer.parseInt(second);
      if (leading <= 12) {
        return isoDate(third, leading, middle, value);
      }
      // Only a leading group that cannot be a month is read as the day.
      if (middle <= 12) {
        return isoDate(third, middle, leading, value);
      }
    }
    return value;
  }

  private static String isoDate(String year, int month, int day, String fallback) {
    if (month < 1 || month > 12 || day < 1 || day > 31) {
      return fallback;
    }
    return String.format("%s-%02d-%02d", year, month, day);
  }

  static String canonicalCurrency(String value) {
    BigDecimal amount = parseDecimal(value.replaceAll("[^\\d.]", ""));
    if (amount == null) {
      return value;
    }
    return "$" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }

  static String canonicalNumeric(String value) {
    BigDecimal number = parseDecimal(value.replaceAll("[,\\s]", ""));
    if (number == null) {
      return value;
    }
    return number.stripTrailingZeros().toPlainString();
  }

  private static BigDecimal parseDecimal(String cleaned) {
    if (cleaned.isEmpty()) {
      return null;
    }
    try {
      return new BigDecimal(cleaned);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  static String canonicalCode(String value) {
    return WHITESPACE_RUN.matcher(value.toUpperCase(Locale.ROOT)).replaceAll("-");
  }

  static String canonicalName(String value) {
    String[] tokens = WHITESPACE_RUN.split(value.toLowerCase(Locale.ROOT));
    StringBuilder result = new StringBuilder(value.length());
    for (String token : tokens) {
      if (token.isEmpty()) {
        continue;
      }
      if (result.length() > 0) {
        result.append(' ');
      }
      if (token.indexOf('\'') >= 0) {
        String[] segments = token.split("'", -1);
        for (int i = 0; i < segments.length; i++) {
          if (i > 0) {
            result.append('\'');
          }
          result.append(capitalize(segments[i]));
        }
      } else {
        result.append(capitalize(token));
      }
    }
    return result.toString();
  }

  private static String capitalize(String token) {
    if (token.isEmpty()) {
      return token;
    }
    return token.substring(0, 1).toUpperCase(Locale.ROOT) + token.substring(1);
  }

  static String canonicalBoolean(String value) {
    String lowered = value.toLowerCase(Locale.ROOT);
    if (TRUE_TOKENS.contains(lowered)) {
      return "true";
    }
    if (FALSE_TOKENS.contains(lowered)) {
      return "false";
    }
    return value;
  }

  static String canonicalUrl(String value) {
    String url = value.toLowerCase(Locale.ROOT);
    if (!url.startsWith("http://") && !url.startsWith("https://")) {
      url = "https://" + url;
    }
    return url;
  }

  static String collapseWhitespace(String value) {
    return WHITESPACE_RUN.matcher(value).replaceAll(" ");
  }
}
