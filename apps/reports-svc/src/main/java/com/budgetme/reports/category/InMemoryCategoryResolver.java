package com.budgetme.reports.category;

import com.budgetme.reports.config.BudgetmeProperties;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Category names seeded from {@code budgetme.categories}; further entries may be registered at runtime.
 */
@Component
public class InMemoryCategoryResolver implements CategoryResolver {

    private final Map<String, String> names = new ConcurrentHashMap<>();

    @Autowired
    public InMemoryCategoryResolver(BudgetmeProperties properties) {
        this(properties.categories());
    }

    public InMemoryCategoryResolver(Map<String, String> seed) {
        seed.forEach(this::register);
    }

    public void register(String categoryId, String name) {
        if (categoryId == null || categoryId.isBlank()) {
            throw new IllegalArgumentException("categoryId must be provided");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must be provided");
        }
        names.put(categoryId, name.trim());
    }

    @Override
    public Optional<String> resolveName(String categoryId) {
        if (categoryId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(names.get(categoryId));
    }
}
