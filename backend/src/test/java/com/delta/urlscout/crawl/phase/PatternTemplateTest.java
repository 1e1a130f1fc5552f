package com.delta.urlscout.crawl.phase;

import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class PatternTemplateTest {

    @Test
    void parsesTrailingNumberIntoTemplate() {
        PatternTemplate.Parsed parsed = PatternTemplate.parse("/news/123");

        assertThat(parsed).isNotNull();
        assertThat(parsed.template().kind()).isEqualTo(PatternTemplate.Kind.NUMBER);
        assertThat(parsed.template().key()).isEqualTo("/news/{number}");
        assertThat(parsed.value()).isEqualTo(123);
        assertThat(parsed.template().render(124)).isEqualTo("/news/124");
    }

    @Test
    void keepsZeroPaddingPrefixAndExtension() {
        PatternTemplate.Parsed parsed = PatternTemplate.parse("/page-007.html");

        assertThat(parsed.template().key()).isEqualTo("/page-{number:3}.html");
        assertThat(parsed.template().render(8)).isEqualTo("/page-008.html");
    }

    @Test
    void recognisesYearMonthDirectories() {
        PatternTemplate.Parsed parsed = PatternTemplate.parse("/archive/2023/07/index.html");

        assertThat(parsed.template().kind()).isEqualTo(PatternTemplate.Kind.YEAR_MONTH);
        assertThat(parsed.value()).isEqualTo(2023 * 12 + 6);
        assertThat(parsed.template().render(2023 * 12 + 7)).isEqualTo("/archive/2023/08/index.html");
    }

    @Test
    void pathsWithoutVariableSegmentHaveNoTemplate() {
        assertThat(PatternTemplate.parse("/about")).isNull();
        assertThat(PatternTemplate.parse("/")).isNull();
    }

    @Test
    void variantsFillGapsThenExtendUpward() {
        PatternTemplate template = PatternTemplate.parse("/news/1").template();
        template.addSample(1);
        template.addSample(2);
        template.addSample(4);

        assertThat(template.variants(10, YearMonth.of(2024, 5)))
            .containsExactly(3, 5, 6, 7, 8, 9, 10, 11, 12, 13);
    }

    @Test
    void yearVariantsStopAfterNextYearThenGoBackward() {
        PatternTemplate template = PatternTemplate.parse("/reports/2023/").template();
        template.addSample(2022);
        template.addSample(2023);

        assertThat(template.variants(4, YearMonth.of(2024, 5))).containsExactly(2024, 2025, 2021, 2020);
    }

    @Test
    void yearMonthVariantsNeverPassTheCurrentMonth() {
        PatternTemplate template = PatternTemplate.parse("/blog/2024/03/").template();
        template.addSample(2024 * 12 + 2);

        assertThat(template.variants(3, YearMonth.of(2024, 4)))
            .containsExactly(2024 * 12 + 3, 2024 * 12 + 1, 2024 * 12);
    }

    @Test
    void rendersAsciiDigitsWhateverTheDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("ar-EG"));
        try {
            PatternTemplate.Parsed monthly = PatternTemplate.parse("/news/2023/05");
            PatternTemplate.Parsed padded = PatternTemplate.parse("/page-007.html");

            assertThat(monthly.template().render(monthly.value() + 1)).isEqualTo("/news/2023/06");
            assertThat(padded.template().render(8)).isEqualTo("/page-008.html");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
