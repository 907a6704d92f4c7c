package com.dataprep.standardizer.UnitTests.service.pattern;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import com.dataprep.standardizer.service.pattern.PatternClassifier;
import com.dataprep.standardizer.service.pattern.PatternFamily;
import com.dataprep.standardizer.service.pattern.PatternMatch;
import com.dataprep.standardizer.service.pattern.ValueCanonicalizer;

@DisplayName("ValueCanonicalizer Tests")
class ValueCanonicalizerTest {

  private ValueCanonicalizer canonicalizer;

  @BeforeEach
  void setUp() {
    canonicalizer = new ValueCanonicalizer();
  }

  @Nested
  @DisplayName("Phone")
  class Phone {

    @Test
    void shouldFormatTenDigitNumbers() {
      assertThat(canonicalizer.canonicalize("555.123.4567", PatternFamily.PHONE))
          .isEqualTo("(555) 123-4567");
      assertThat(canonicalizer.canonicalize("(555) 123 4567", PatternFamily.PHONE))
          .isEqualTo("(555) 123-4567");
    }

    @Test
    void shouldFormatElevenDigitNumbersWithCountryCode() {
      assertThat(canonicalizer.canonicalize("1-555-123-4567", PatternFamily.PHONE))
          .isEqualTo("+1 (555) 123-4567");
    }

    @Test
    void shouldReturnBareDigitsForOtherLengths() {
      assertThat(canonicalizer.canonicalize("555-1234", PatternFamily.PHONE)).isEqualTo("5551234");
      assertThat(canonicalizer.canonicalize("+44 20 7946 0958", PatternFamily.PHONE))
          .isEqualTo("442079460958");
    }
  }

  @Nested
  @DisplayName("Date")
  class Date {

    @ParameterizedTest
    @CsvSource({
      "01/15/2023, 2023-01-15",
      "1/5/2023, 2023-01-05",
      "2023/1/5, 2023-01-05",
      "2023.12.31, 2023-12-31",
      "25-12-2023, 2023-12-25"
    })
    void shouldRewriteToIsoFormat(String input, String expected) {
      assertThat(canonicalizer.canonicalize(input, PatternFamily.DATE)).isEqualTo(expected);
    }

    @Test
    void shouldLeaveIsoDatesUntouched() {
      assertThat(canonicalizer.canonicalize("2023-01-20", PatternFamily.DATE))
          .isEqualTo("2023-01-20");
    }

    @ParameterizedTest
    @CsvSource({"03/04/23", "12/31/99", "13/14/2023", "2023/13/01"})
    void shouldReturnAmbiguousOrInvalidDatesUnchanged(String input) {
      assertThat(canonicalizer.canonicalize(input, PatternFamily.DATE)).isEqualTo(input);
    }
  }

  @Nested
  @DisplayName("Numbers")
  class Numbers {

    @Test
    void shouldRenderCurrencyWithTwoDecimals() {
      assertThat(canonicalizer.canonicalize("$1,234.5", PatternFamily.CURRENCY))
          .isEqualTo("$1234.50");
      assertThat(canonicalizer.canonicalize("€12", PatternFamily.CURRENCY)).isEqualTo("$12.00");
      assertThat(canonicalizer.canonicalize("9.999 £", PatternFamily.CURRENCY))
          .isEqualTo("$10.00");
    }

    @Test
    void shouldReturnUnparsableCurrencyUnchanged() {
      assertThat(canonicalizer.canonicalize("$", PatternFamily.CURRENCY)).isEqualTo("$");
    }

    @Test
    void shouldStripThousandsSeparators() {
      assertThat(canonicalizer.canonicalize("1,234", PatternFamily.NUMERIC_FORMATTED))
          .isEqualTo("1234");
      assertThat(canonicalizer.canonicalize("12 345.50", PatternFamily.NUMERIC_FORMATTED))
          .isEqualTo("12345.5");
      assertThat(canonicalizer.canonicalize("1,000", PatternFamily.NUMERIC_FORMATTED))
          .isEqualTo("1000");
    }
  }

  @Nested
  @DisplayName("Text families")
  class TextFamilies {

    @Test
    void shouldLowercaseEmails() {
      assertThat(canonicalizer.canonicalize("Jane.Doe@Example.COM", PatternFamily.EMAIL))
          .isEqualTo("jane.doe@example.com");
    }

    @Test
    void shouldUppercaseCodesAndHyphenateSpaces() {
      assertThat(canonicalizer.canonicalize("sku  42x", PatternFamily.CODE)).isEqualTo("SKU-42X");
    }

    @ParameterizedTest
    @CsvSource(
        quoteCharacter = '"',
        value = {
          "john smith, John Smith",
          "JOHN   SMITH, John Smith",
          "o'brien, O'Brien",
          "mary o'neil-jones, Mary O'Neil-jones"
        })
    void shouldTitleCaseNames(String input, String expected) {
      assertThat(canonicalizer.canonicalize(input, PatternFamily.NAME)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
      "YES, true",
      "y, true",
      "On, true",
      "enabled, true",
      "1, true",
      "No, false",
      "OFF, false",
      "disabled, false",
      "0, false"
    })
    void shouldMapBooleanTokens(String input, String expected) {
      assertThat(canonicalizer.canonicalize(input, PatternFamily.BOOLEAN)).isEqualTo(expected);
    }

    @Test
    void shouldLowercaseUrlsAndAddScheme() {
      assertThat(canonicalizer.canonicalize("Example.COM/Docs", PatternFamily.URL))
          .isEqualTo("https://example.com/docs");
      assertThat(canonicalizer.canonicalize("http://example.com", PatternFamily.URL))
          .isEqualTo("http://example.com");
    }

    @Test
    void shouldOnlyCollapseWhitespaceForText() {
      assertThat(canonicalizer.canonicalize("ACME   Corp &  Co", PatternFamily.TEXT))
          .isEqualTo("ACME Corp & Co");
    }
  }

  @Nested
  @DisplayName("Idempotence")
  class Idempotence {

    private final PatternClassifier classifier = new PatternClassifier();

    static Stream<Arguments> values() {
      return Stream.of(
          Arguments.of("(555) 123 4567"),
          Arguments.of("1 (555) 123-4567"),
          Arguments.of("555-1234"),
          Arguments.of("Jane.Doe@Example.com"),
          Arguments.of("01/15/2023"),
          Arguments.of("2023.1.5"),
          Arguments.of("$1,234.5"),
          Arguments.of("12 £"),
          Arguments.of("1,234.50"),
          Arguments.of("sku 42x"),
          Arguments.of("o'brien"),
          Arguments.of("john   SMITH"),
          Arguments.of("Mary-Jane"),
          Arguments.of("Enabled"),
          Arguments.of("Example.com"),
          Arguments.of("a   b   c &"));
    }

    @ParameterizedTest
    @MethodSource("values")
    void canonicalizingTwiceEqualsCanonicalizingOnce(String value) {
      PatternMatch match = classifier.classify(value);
      String once = canonicalizer.canonicalize(value, match.getFamily());
      String twice = canonicalizer.canonicalize(once, match.getFamily());

      assertThat(twice).isEqualTo(once);
    }
  }
}
