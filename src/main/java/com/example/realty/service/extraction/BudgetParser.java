package com.example.realty.service.extraction;

import com.example.realty.service.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Reads a budget out of free text: digit groupings, k/m shorthand, ranges, upper and lower bounds.
 */
@Slf4j
@Component
public class BudgetParser {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000L);
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000L);
    private static final BigDecimal BILLION = BigDecimal.valueOf(1_000_000_000L);
    private static final long MAX_BUDGET = 100_000_000_000L;
    private static final long MIN_UNMARKED = 10_000L;

    private static final Map<String, BigDecimal> MULTIPLIERS = Map.ofEntries(
            entry("k", THOUSAND), entry("thousand", THOUSAND), entry("thousands", THOUSAND),
            entry("هزار", THOUSAND), entry("ألف", THOUSAND), entry("الف", THOUSAND),
            entry("тыс", THOUSAND), entry("тысяч", THOUSAND),
            entry("m", MILLION), entry("mm", MILLION), entry("mn", MILLION), entry("mln", MILLION),
            entry("mil", MILLION), entry("million", MILLION), entry("millions", MILLION),
            entry("میلیون", MILLION), entry("ملیون", MILLION), entry("مليون", MILLION),
            entry("млн", MILLION), entry("миллион", MILLION), entry("миллиона", MILLION), entry("миллионов", MILLION),
            entry("b", BILLION), entry("bn", BILLION), entry("billion", BILLION),
            entry("میلیارد", BILLION), entry("مليار", BILLION), entry("млрд", BILLION), entry("миллиард", BILLION)
    );

    private static final Pattern AMOUNT = Pattern.compile(
            "(?<![\\d.,])(\\d{1,3}(?:[, ]\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)\\s*"
                    + "(thousands|thousand|millions|million|billion|mil|mln|mn|mm|bn|k|m|b"
                    + "|هزار|میلیون|ملیون|مليون|میلیارد|مليار|ألف|الف"
                    + "|тысяч|тыс|миллионов|миллиона|миллион|млн|млрд|миллиард)?(?![\\p{L}\\d])");

    private static final Pattern PHONE_LIKE = Pattern.compile("\\+?\\d[\\d \\-().]{6,}\\d");
    private static final Pattern THOUSANDS_GROUPING = Pattern.compile("\\d{1,3}(?:[, ]\\d{3})+");

    private static final Pattern BUDGET_CONTEXT = Pattern.compile(
            "(budget|price|cost|aed|dhs|dirham|usd|dollar|eur|\\$|€|spend|afford|invest"
                    + "|بودجه|قیمت|درهم|دلار|ميزانية|سعر|دولار"
                    + "|бюджет|цен|стоимост|дирхам|доллар)");

    private static final Pattern RANGE_CONNECTOR = Pattern.compile(
            "^\\s*(?:aed|usd|dhs|\\$)?\\s*(?:-|to|and|till|until|or|تا|الى|إلى|و|до|и)\\s*(?:aed|usd|dhs|\\$)?\\s*$");

    private static final Pattern MAX_MARKER = Pattern.compile(
            "(up ?to|under|below|less than|max(?:imum)?|no more than|not more than|within|not over"
                    + "|حداکثر|تا سقف|زیر|کمتر از|حتى|أقل من|بحد أقصى"
                    + "|до|не более|максимум|меньше)\\s*(?:aed|usd|dhs|\\$)?\\s*$");

    private static final Pattern MIN_MARKER = Pattern.compile(
            "(from|at least|min(?:imum)?|over|above|more than|starting(?: at| from)?"
                    + "|حداقل|بیشتر از|از|على الأقل|أكثر من|من"
                    + "|от|минимум|не менее|больше)\\s*(?:aed|usd|dhs|\\$)?\\s*$");

    public Optional<BudgetRange> parse(String text) {
        return parse(text, false);
    }

    /**
     * @param budgetExpected the lead was just asked for a budget, so bare small numbers count
     */
    public Optional<BudgetRange> parse(String text, boolean budgetExpected) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        String normalized = stripPhoneNumbers(TextNormalizer.normalize(text));
        List<Amount> amounts = findAmounts(normalized);
        if (amounts.isEmpty()) {
            return Optional.empty();
        }

        boolean context = budgetExpected || BUDGET_CONTEXT.matcher(normalized).find();

        for (int i = 0; i + 1 < amounts.size(); i++) {
            Amount first = amounts.get(i);
            Amount second = amounts.get(i + 1);
            String between = normalized.substring(first.end(), second.start());
            if (!RANGE_CONNECTOR.matcher(between).matches()) {
                continue;
            }
            if (first.multiplier() == null && second.multiplier() != null && first.raw().compareTo(THOUSAND) < 0) {
                first = new Amount(first.start(), first.end(), first.raw(), second.multiplier());
            }
            Long low = scale(first, context || second.multiplier() != null);
            Long high = scale(second, context || first.multiplier() != null);
            if (low != null && high != null) {
                return Optional.of(BudgetRange.between(low, high));
            }
        }

        // figures with a unit or at full size win over bare small numbers ("3 kids, budget 2m")
        List<Amount> ordered = new ArrayList<>();
        amounts.stream().filter(Amount::isExplicit).forEach(ordered::add);
        amounts.stream().filter(a -> !a.isExplicit()).forEach(ordered::add);

        for (Amount amount : ordered) {
            Long value = scale(amount, context);
            if (value == null) {
                continue;
            }
            String before = normalized.substring(Math.max(0, amount.start() - 25), amount.start());
            if (MAX_MARKER.matcher(before).find()) {
                return Optional.of(BudgetRange.atMost(value));
            }
            if (MIN_MARKER.matcher(before).find()) {
                return Optional.of(BudgetRange.atLeast(value));
            }
            return Optional.of(BudgetRange.exactly(value));
        }
        return Optional.empty();
    }

    private List<Amount> findAmounts(String text) {
        List<Amount> result = new ArrayList<>();
        Matcher matcher = AMOUNT.matcher(text);
        while (matcher.find()) {
            try {
                BigDecimal raw = new BigDecimal(matcher.group(1).replace(",", "").replace(" ", ""));
                BigDecimal multiplier = matcher.group(2) == null ? null : MULTIPLIERS.get(matcher.group(2));
                result.add(new Amount(matcher.start(), matcher.end(), raw, multiplier));
            } catch (NumberFormatException e) {
                log.debug("Skipping unparsable amount '{}': {}", matcher.group(), e.getMessage());
            }
        }
        return result;
    }

    /**
     * Unmarked numbers below a thousand are read as millions (under 100) or thousands,
     * but only when the message is about money.
     */
    private Long scale(Amount amount, boolean context) {
        BigDecimal value;
        if (amount.multiplier() != null) {
            value = amount.raw().multiply(amount.multiplier());
        } else if (amount.raw().compareTo(THOUSAND) < 0) {
            if (!context || amount.raw().signum() <= 0) {
                return null;
            }
            value = amount.raw().compareTo(BigDecimal.valueOf(100)) < 0
                    ? amount.raw().multiply(MILLION)
                    : amount.raw().multiply(THOUSAND);
        } else {
            value = amount.raw();
            if (!context && value.longValue() < MIN_UNMARKED) {
                return null;
            }
        }
        long result = value.longValue();
        if (result <= 0 || result > MAX_BUDGET) {
            return null;
        }
        return result;
    }

    private String stripPhoneNumbers(String text) {
        Matcher matcher = PHONE_LIKE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String candidate = matcher.group().trim();
            matcher.appendReplacement(sb, looksLikePhone(candidate) ? " " : Matcher.quoteReplacement(matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private boolean looksLikePhone(String candidate) {
        if (candidate.startsWith("+")) {
            return true;
        }
        String[] segments = candidate.split("[^\\d]+");
        int digits = 0;
        boolean shortSegments = true;
        for (String segment : segments) {
            digits += segment.length();
            if (segment.length() > 4) {
                shortSegments = false;
            }
        }
        if (digits < 9) {
            return false;
        }
        if (segments.length == 1) {
            return digits >= 10;
        }
        return shortSegments && !THOUSANDS_GROUPING.matcher(candidate).matches();
    }

    private record Amount(int start, int end, BigDecimal raw, BigDecimal multiplier) {
        boolean isExplicit() {
            return multiplier != null || raw.compareTo(THOUSAND) >= 0;
        }
    }
}
