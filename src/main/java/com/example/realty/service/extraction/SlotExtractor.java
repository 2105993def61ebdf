package com.example.realty.service.extraction;

import com.example.realty.config.EngineProperties;
import com.example.realty.controllers.InferenceApiClient;
import com.example.realty.model.Language;
import com.example.realty.model.SlotNames;
import com.example.realty.service.util.TextNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Turns one message into candidate slot values. The extraction service is asked once; local rules fill
 * whatever it did not return. Slots the lead already has are never part of the result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotExtractor {

    public static final String GOAL_INVESTMENT = "investment";
    public static final String GOAL_LIVING = "living";
    public static final String GOAL_RESIDENCY = "residency";

    // residency first: "golden visa for my family" is about the visa
    private static final List<Map.Entry<String, Pattern>> GOALS = List.of(
            entry(GOAL_RESIDENCY, Pattern.compile(
                    "(residen|visa|passport|اقامت|ویزا|إقامة|اقامة|تأشيرة|فيزا|виза|вид на жительство|резиден|внж)")),
            entry(GOAL_INVESTMENT, Pattern.compile(
                    "(invest|roi|rental income|yield|profit|سرمایه|سود|استثمار|عائد|инвест|доход|прибыл)")),
            entry(GOAL_LIVING, Pattern.compile(
                    "(\\blive\\b|living|to live|family home|move to|relocat|زندگی|سکونت|للسكن|العيش|السكن|жить|прожива|переезд)"))
    );

    private static final List<Map.Entry<String, Pattern>> PROPERTY_TYPES = List.of(
            entry("penthouse", Pattern.compile("(penthouse|پنت ?هاوس|بنتهاوس|пентхаус)")),
            entry("townhouse", Pattern.compile("(townhouse|town house|تاون ?هاوس|تاون هاوس|таунхаус)")),
            entry("villa", Pattern.compile("(villa|ویلا|فيلا|فلة|вилл)")),
            entry("studio", Pattern.compile("(studio|استودیو|ستوديو|студи)")),
            entry("apartment", Pattern.compile("(apartment|flat|condo|\\d ?br\\b|bedroom|آپارتمان|اپارتمان|شقة|квартир|апартамент)")),
            entry("office", Pattern.compile("(office|commercial|shop|retail|دفتر|تجاری|مغازه|مكتب|تجاري|офис|коммерч|магазин)")),
            entry("land", Pattern.compile("(\\bplot\\b|\\bland\\b|زمین|أرض|ارض|участ|земл)"))
    );

    private final InferenceApiClient inferenceApiClient;
    private final BudgetParser budgetParser;
    private final ObjectMapper objectMapper;
    private final EngineProperties properties;

    public PartialSlots extract(String text, Map<String, String> knownSlots, Language language) {
        return extract(text, knownSlots, language, false);
    }

    /**
     * @param budgetExpected the lead was just asked for a budget, so bare numbers like "750" count as one
     */
    public PartialSlots extract(String text, Map<String, String> knownSlots, Language language, boolean budgetExpected) {
        if (text == null || text.isBlank()) {
            return PartialSlots.empty();
        }
        Language lang = language == null ? Language.EN : language;

        PartialSlots remote = inferenceApiClient.extractEntities(text, lang)
                .map(this::parseRemote)
                .orElse(PartialSlots.empty());

        PartialSlots local = extractLocally(text, budgetExpected);

        PartialSlots result = remote.orElse(local).withoutKnown(knownSlots);
        log.debug("Extracted {} from '{}'", result, text);
        return result;
    }

    /** Rule-based pass with no network call. */
    public PartialSlots extractLocally(String text, boolean budgetExpected) {
        if (text == null || text.isBlank()) {
            return PartialSlots.empty();
        }
        String normalized = TextNormalizer.normalize(text);
        Map<String, String> values = new LinkedHashMap<>();

        detectGoal(normalized).ifPresent(goal -> values.put(SlotNames.GOAL, goal));
        firstMatch(PROPERTY_TYPES, normalized).ifPresent(type -> values.put(SlotNames.PROPERTY_TYPE, type));
        detectLocation(normalized).ifPresent(location -> values.put(SlotNames.LOCATION, location));
        budgetParser.parse(text, budgetExpected).ifPresent(range -> putBudget(values, range));

        return PartialSlots.of(values);
    }

    public Optional<String> detectGoal(String text) {
        return firstMatch(GOALS, TextNormalizer.normalize(text));
    }

    PartialSlots parseRemote(String raw) {
        try {
            JsonNode root = objectMapper.readTree(raw);
            if (root == null || !root.isObject()) {
                log.warn("Extraction output is not a JSON object, ignoring it");
                return PartialSlots.empty();
            }
            Map<String, String> values = new LinkedHashMap<>();

            String goal = text(root, SlotNames.GOAL);
            if (goal != null) {
                detectGoal(goal).ifPresent(g -> values.put(SlotNames.GOAL, g));
            }
            putIfPresent(values, SlotNames.PROPERTY_TYPE, text(root, SlotNames.PROPERTY_TYPE));
            String location = text(root, SlotNames.LOCATION);
            if (location != null && !location.isBlank()) {
                values.put(SlotNames.LOCATION, location.trim());
            }

            readBudgetBound(root, SlotNames.BUDGET_MIN).ifPresent(v -> values.put(SlotNames.BUDGET_MIN, v));
            readBudgetBound(root, SlotNames.BUDGET_MAX).ifPresent(v -> values.put(SlotNames.BUDGET_MAX, v));
            String budget = text(root, "budget");
            if (budget != null && !values.containsKey(SlotNames.BUDGET_MIN) && !values.containsKey(SlotNames.BUDGET_MAX)) {
                budgetParser.parse(budget, true).ifPresent(range -> putBudget(values, range));
            }
            return PartialSlots.of(values);
        } catch (Exception e) {
            log.warn("Malformed extraction output, treating as no extraction: {}", e.getMessage());
            return PartialSlots.empty();
        }
    }

    private Optional<String> readBudgetBound(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            long value = node.asLong();
            return value > 0 ? Optional.of(String.valueOf(value)) : Optional.empty();
        }
        if (node.isTextual()) {
            return budgetParser.parse(node.asText(), true)
                    .map(range -> range.min() != null ? range.min() : range.max())
                    .map(String::valueOf);
        }
        return Optional.empty();
    }

    private Optional<String> detectLocation(String normalized) {
        for (String location : properties.getExtraction().getKnownLocations()) {
            if (normalized.contains(location.toLowerCase(Locale.ROOT))) {
                return Optional.of(location);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstMatch(List<Map.Entry<String, Pattern>> rules, String normalized) {
        for (Map.Entry<String, Pattern> rule : rules) {
            if (rule.getValue().matcher(normalized).find()) {
                return Optional.of(rule.getKey());
            }
        }
        return Optional.empty();
    }

    private static void putBudget(Map<String, String> values, BudgetRange range) {
        if (range.min() != null) {
            values.put(SlotNames.BUDGET_MIN, String.valueOf(range.min()));
        }
        if (range.max() != null) {
            values.put(SlotNames.BUDGET_MAX, String.valueOf(range.max()));
        }
    }

    private static void putIfPresent(Map<String, String> values, String key, String value) {
        if (value != null && !value.isBlank()) {
            values.put(key, value.trim().toLowerCase(Locale.ROOT));
        }
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }
}
