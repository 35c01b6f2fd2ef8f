package com.budgetme.reports.controller;

import com.budgetme.reports.category.InMemoryCategoryResolver;
import com.budgetme.reports.controller.dto.CategoryRequestDto;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/categories")
public class CategoriesController {

    private final InMemoryCategoryResolver categoryResolver;

    public CategoriesController(InMemoryCategoryResolver categoryResolver) {
        this.categoryResolver = categoryResolver;
    }

    @PutMapping("/{categoryId}")
    public ResponseEntity<Map<String, String>> registerCategory(
            @PathVariable("categoryId") String categoryId,
            @Valid @RequestBody CategoryRequestDto request
    ) {
        categoryResolver.register(categoryId, request.name());
        return ResponseEntity.ok(Map.of("id", categoryId, "name", request.name().trim()));
    }
}
