package com.budgetme.reports.model;

import java.util.Locale;
import java.util.Optional;

public record Insight(
        String id,
        Category category,
        String icon,
        String title,
        String description,
        boolean actionable,
        Optional<String> actionText
) {
    public Insight {
        if (category == null) {
            throw new IllegalArgumentException("category must be provided");
        }
        if (icon == null || icon.isBlank()) {
            icon = category.icon();
        }
        actionText = actionText == null ? Optional.empty() : actionText.filter(text -> !text.isBlank());
    }

    public static Insight of(String id, Category category, String title, String description) {
        return new Insight(id, category, category.icon(), title, description, false, Optional.empty());
    }

    public static Insight actionable(String id, Category category, String title, String description, String actionText) {
        return new Insight(id, category, category.icon(), title, description, true, Optional.ofNullable(actionText));
    }

    public Insight withText(String newTitle, String newDescription, Optional<String> newActionText) {
        return new Insight(id, category, icon, newTitle, newDescription, actionable, newActionText);
    }

    public enum Category {
        SUCCESS("fas fa-check-circle"),
        WARNING("fas fa-exclamation-triangle"),
        INFO("fas fa-info-circle"),
        TIP("fas fa-lightbulb");

        private final String icon;

        Category(String icon) {
            this.icon = icon;
        }

        public String icon() {
            return icon;
        }

        public static Optional<Category> fromCode(String code) {
            if (code == null) {
                return Optional.empty();
            }
            try {
                return Optional.of(valueOf(code.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException ex) {
                return Optional.empty();
            }
        }
    }
}
