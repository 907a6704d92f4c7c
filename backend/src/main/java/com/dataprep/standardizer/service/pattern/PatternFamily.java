package com.dataprep.standardizer.service.pattern;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Semantic value families, declared in evaluation order. Classification walks the constants top to
 * bottom and stops at the first whose shape predicate accepts the value; {@link #TEXT} accepts
 * everything and closes the table.
 */
public enum PatternFamily {
  PHONE("Phone-like", 0.8, PatternRules::isPhone, PatternRules::canonicalPhone),
  EMAIL("Email-like", 0.9, PatternRules::isEmail, PatternRules::canonicalEmail),
  DATE("Date-like", 0.85, PatternRules::isDate, PatternRules::canonicalDate),
  BOOLEAN("Boolean-like", 0.9, PatternRules::isBoolean, PatternRules::canonicalBoolean),
  CURRENCY("Currency-like", 0.7, PatternRules::isCurrency, PatternRules::canonicalCurrency),
  NUMERIC_FORMATTED(
      "Numeric-formatted", 0.6, PatternRules::isNumericFormatted, PatternRules::canonicalNumeric),
  URL("URL-like", 0.8, PatternRules::isUrl, PatternRules::canonicalUrl),
  CODE("Code-like", 0.5, PatternRules::isCode, PatternRules::canonicalCode),
  NAME("Name-like", 0.4, PatternRules::isName, PatternRules::canonicalName),
  TEXT("Text", 0.1, value -> true, PatternRules::collapseWhitespace);

  private final String displayName;
  private final double baseConfidence;
  private final Predicate<String> shape;
  private final UnaryOperator<String> canonicalForm;

  PatternFamily(
      String displayName,
      double baseConfidence,
      Predicate<String> shape,
      UnaryOperator<String> canonicalForm) {
    this.displayName = displayName;
    this.baseConfidence = baseConfidence;
    this.shape = shape;
    this.canonicalForm = canonicalForm;
  }

  public String getDisplayName() {
    return displayName;
  }

  public double getBaseConfidence() {
    return baseConfidence;
  }

  boolean matches(String trimmedValue) {
    return shape.test(trimmedValue);
  }

  String canonicalize(String trimmedValue) {
    return canonicalForm.apply(trimmedValue);
  }
}
