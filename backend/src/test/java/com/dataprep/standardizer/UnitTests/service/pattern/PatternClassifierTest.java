package com.dataprep.standardizer.UnitTests.service.pattern;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.dataprep.standardizer.service.pattern.PatternClassifier;
import com.dataprep.standardizer.service.pattern.PatternFamily;
import com.dataprep.standardizer.service.pattern.PatternMatch;

@DisplayName("PatternClassifier Tests")
class PatternClassifierTest {

  private PatternClassifier classifier;

  @BeforeEach
  void setUp() {
    classifier = new PatternClassifier();
  }

  @Nested
  @DisplayName("Family detection")
  class FamilyDetection {

    @ParameterizedTest
    @ValueSource(strings = {"(555) 123-4567", "5551234567", "+1 555.123.4567", "555-1234"})
    void shouldClassifyPhoneNumbers(String value) {
      assertThat(classifier.classify(value).getFamily()).isEqualTo(PatternFamily.PHONE);
    }

    @Test
    void shouldClassifyEmailWithHighConfidence() {
      PatternMatch match = classifier.classify("Jane.Doe@Example.com");

      assertThat(match.getFamily()).isEqualTo(PatternFamily.EMAIL);
      assertThat(match.getConfidence()).isEqualTo(0.9);
    }

    @ParameterizedTest
    @ValueSource(strings = {"01/15/2023", "2023-01-20", "2023.1.5", "15-01-2023"})
    void shouldClassifyDates(String value) {
      assertThat(classifier.classify(value).getFamily()).isEqualTo(PatternFamily.DATE);
    }

    @Test
    @DisplayName("ISO dates are not mistaken for phone numbers")
    void shouldPreferDateOverPhoneForIsoDates() {
      assertThat(classifier.classify("2023-01-20").getFamily()).isEqualTo(PatternFamily.DATE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"YES", "no", "True", "0", "1", "Enabled", "off", "y"})
    void shouldClassifyBooleanTokens(String value) {
      assertThat(classifier.classify(value).getFamily()).isEqualTo(PatternFamily.BOOLEAN);
    }

    @ParameterizedTest
    @ValueSource(strings = {"$1,234.50", "€12", "12.5 £", "$ 40"})
    void shouldClassifyCurrency(String value) {
      assertThat(classifier.classify(value).getFamily()).isEqualTo(PatternFamily.CURRENCY);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1,234", "12,345.67", "1 000"})
    void shouldClassifyNumericWithSeparators(String value) {
      assertThat(classifier.classify(value).getFamily())
          .isEqualTo(PatternFamily.NUMERIC_FORMATTED);
    }

    @ParameterizedTest
    @ValueSource(strings = {"example.com", "https://Example.org/path", "www.test.co.uk"})
    void shouldClassifyUrls(String value) {
      assertThat(classifier.classify(value).getFamily()).isEqualTo(PatternFamily.URL);
    }

    @ParameterizedTest
    @ValueSource(strings = {"AB-123", "sku 42x", "x1y"})
    void shouldClassifyCodes(String value) {
      assertThat(classifier.classify(value).getFamily()).isEqualTo(PatternFamily.CODE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"John Smith", "o'brien", "Mary-Jane", "J. R. Tolkien"})
    void shouldClassifyNames(String value) {
      PatternMatch match = classifier.classify(value);

      assertThat(match.getFamily()).isEqualTo(PatternFamily.NAME);
      assertThat(match.getConfidence()).isEqualTo(0.4);
    }

    @ParameterizedTest
    @ValueSource(strings = {"ACME Corp & Co", "Hello, world!", "ab", "#42"})
    void shouldFallBackToText(String value) {
      PatternMatch match = classifier.classify(value);

      assertThat(match.getFamily()).isEqualTo(PatternFamily.TEXT);
      assertThat(match.getConfidence()).isEqualTo(0.1);
    }
  }

  @Nested
  @DisplayName("Robustness")
  class Robustness {

    @Test
    void shouldTrimBeforeClassifying() {
      assertThat(classifier.classify("  yes  ").getFamily()).isEqualTo(PatternFamily.BOOLEAN);
    }

    @Test
    void shouldNeverFailOnNullOrEmpty() {
      assertThat(classifier.classify(null).getFamily()).isEqualTo(PatternFamily.TEXT);
      assertThat(classifier.classify("").getFamily()).isEqualTo(PatternFamily.TEXT);
    }

    @Test
    void shouldOnlyUseMatchesAboveThreshold() {
      assertThat(classifier.classify("John Smith").isAbove(0.3)).isTrue();
      assertThat(classifier.classify("ACME & Co").isAbove(0.3)).isFalse();
    }
  }
}
