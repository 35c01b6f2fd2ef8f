package com.budgetme.reports.ai;

import com.budgetme.reports.model.Insight;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class InsightResponseParser {

    private static final Logger log = LoggerFactory.getLogger(InsightResponseParser.class);

    private final ObjectMapper objectMapper;

    public InsightResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Extracts the JSON array between the first '[' and the last ']' and maps each usable element to an insight.
     * Elements without a title or with an unknown type are skipped.
     */
    public List<Insight> parse(String rawResponse) throws InsightResponseParseException {
        if (rawResponse == null || rawResponse.isBlank()) {
            throw new InsightResponseParseException("Generated text is empty");
        }
        String text = stripFences(rawResponse.trim());
        int start = text.indexOf('[');
        int end = text.lastIndexOf(']');
        if (start < 0 || end <= start) {
            throw new InsightResponseParseException("No JSON array found in generated text");
        }

        JsonNode array;
        try {
            array = objectMapper.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException ex) {
            throw new InsightResponseParseException("Generated JSON array is malformed", ex);
        }
        if (array == null || !array.isArray()) {
            throw new InsightResponseParseException("Generated JSON is not an array");
        }

        List<Insight> insights = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            Optional<Insight> insight = toInsight(element, insights.size());
            if (insight.isPresent()) {
                insights.add(insight.get());
            } else {
                log.debug("Skipping unusable generated insight element: {}", element);
            }
        }
        if (insights.isEmpty()) {
            throw new InsightResponseParseException("Generated array holds no usable insights");
        }
        return List.copyOf(insights);
    }

    private Optional<Insight> toInsight(JsonNode element, int index) {
        if (element == null || !element.isObject()) {
            return Optional.empty();
        }
        String title = textOrNull(element, "title");
        if (title == null) {
            return Optional.empty();
        }
        Optional<Insight.Category> category = Insight.Category.fromCode(textOrNull(element, "type"));
        if (category.isEmpty()) {
            return Optional.empty();
        }
        String description = Optional.ofNullable(textOrNull(element, "description")).orElse("");
        boolean actionable = element.path("actionable").asBoolean(false);
        Optional<String> actionText = actionable ? Optional.ofNullable(textOrNull(element, "actionText")) : Optional.empty();
        return Optional.of(new Insight(
                "insight-" + index,
                category.get(),
                category.get().icon(),
                title,
                description,
                actionable,
                actionText));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static String stripFences(String text) {
        String s = text;
        if (s.startsWith("```")) {
            int firstNl = s.indexOf('\n');
            if (firstNl > 0) {
                s = s.substring(firstNl + 1);
            }
            int fence = s.lastIndexOf("```");
            if (fence >= 0) {
                s = s.substring(0, fence);
            }
        }
        return s.trim();
    }
}
