package com.example.realty.service.extraction;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class BudgetParserTest {

    private final BudgetParser parser = new BudgetParser();

    @Test
    void shouldReadShorthandMillions() {
        assertThat(parser.parse("my budget is 2m")).contains(BudgetRange.exactly(2_000_000L));
    }

    @Test
    void shouldPropagateSuffixAcrossRange() {
        assertThat(parser.parse("between 1.5 and 2 million"))
                .contains(BudgetRange.between(1_500_000L, 2_000_000L));
    }

    @Test
    void shouldReadUpperBound() {
        assertThat(parser.parse("up to 800k")).contains(BudgetRange.atMost(800_000L));
    }

    @Test
    void shouldReadLowerBound() {
        assertThat(parser.parse("at least 3m")).contains(BudgetRange.atLeast(3_000_000L));
    }

    @Test
    void shouldReadThousandsGroupingWithCurrency() {
        assertThat(parser.parse("1,500,000 AED")).contains(BudgetRange.exactly(1_500_000L));
    }

    @Test
    void shouldReadPersianDigitsAndUnit() {
        assertThat(parser.parse("بودجه ۲ میلیون")).contains(BudgetRange.exactly(2_000_000L));
    }

    @Test
    void shouldReadRussianRange() {
        assertThat(parser.parse("бюджет от 500 тыс до 1 млн"))
                .contains(BudgetRange.between(500_000L, 1_000_000L));
    }

    @Test
    void shouldNotMistakePhoneNumberForBudget() {
        assertThat(parser.parse("call me at +971 50 123 4567")).isEmpty();
    }

    @Test
    void shouldIgnoreSmallNumbersWithoutMoneyContext() {
        assertThat(parser.parse("I have 3 kids")).isEmpty();
    }

    @Test
    void shouldReadBareNumberWhenBudgetWasAsked() {
        assertThat(parser.parse("2", true)).contains(BudgetRange.exactly(2_000_000L));
        assertThat(parser.parse("750", true)).contains(BudgetRange.exactly(750_000L));
    }

    @Test
    void shouldPreferExplicitAmountOverBareNumber() {
        Optional<BudgetRange> parsed = parser.parse("3 kids, budget 2m");

        assertThat(parsed).contains(BudgetRange.exactly(2_000_000L));
    }

    @Test
    void shouldReturnEmptyForBlankText() {
        assertThat(parser.parse("   ")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }
}
