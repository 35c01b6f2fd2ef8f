package com.budgetme.reports.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.budgetme.reports.model.Insight;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class InsightResponseParserTest {

    private final InsightResponseParser parser = new InsightResponseParser(new ObjectMapper());

    @Test
    void parsesFencedArraySurroundedByProse() throws Exception {
        String raw = """
                ```json
                Here are your insights:
                [
                  {"type": "warning", "title": "Food Is Climbing", "description": "Food rose 40%.", "actionable": true, "actionText": "Set a limit"},
                  {"type": "success", "title": "Steady Savings", "description": "You saved 22%.", "actionable": false, "actionText": "ignored"}
                ]
                Hope this helps.
                ```""";

        List<Insight> insights = parser.parse(raw);

        assertThat(insights).hasSize(2);
        Insight first = insights.get(0);
        assertThat(first.id()).isEqualTo("insight-0");
        assertThat(first.category()).isEqualTo(Insight.Category.WARNING);
        assertThat(first.icon()).isEqualTo(Insight.Category.WARNING.icon());
        assertThat(first.actionText()).contains("Set a limit");
        assertThat(insights.get(1).actionable()).isFalse();
        assertThat(insights.get(1).actionText()).isEmpty();
    }

    @Test
    void skipsElementsWithoutTitleOrWithUnknownType() throws Exception {
        String raw = """
                [
                  {"type": "info", "description": "no title"},
                  {"type": "celebration", "title": "Unknown type"},
                  "not an object",
                  {"type": "TIP", "title": "Automate savings"}
                ]""";

        List<Insight> insights = parser.parse(raw);

        assertThat(insights).singleElement().satisfies(insight -> {
            assertThat(insight.id()).isEqualTo("insight-0");
            assertThat(insight.category()).isEqualTo(Insight.Category.TIP);
            assertThat(insight.description()).isEmpty();
        });
    }

    @Test
    void rejectsTextWithoutUsableArray() {
        assertThatThrownBy(() -> parser.parse("I cannot help with that."))
                .isInstanceOf(InsightResponseParseException.class);
        assertThatThrownBy(() -> parser.parse("[ {\"type\": \"info\", \"title\": ]"))
                .isInstanceOf(InsightResponseParseException.class);
        assertThatThrownBy(() -> parser.parse("[{\"type\": \"info\"}]"))
                .isInstanceOf(InsightResponseParseException.class)
                .hasMessageContaining("no usable insights");
        assertThatThrownBy(() -> parser.parse("   "))
                .isInstanceOf(InsightResponseParseException.class);
    }
}
