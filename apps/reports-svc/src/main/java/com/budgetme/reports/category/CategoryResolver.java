package com.budgetme.reports.category;

import java.util.Optional;

public interface CategoryResolver {

    Optional<String> resolveName(String categoryId);
}
