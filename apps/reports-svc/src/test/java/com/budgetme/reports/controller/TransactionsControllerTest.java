package com.budgetme.reports.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.budgetme.reports.security.TraceIdFilter;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class TransactionsControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Test
    void recordListAndDeleteOwnTransactions() throws Exception {
        UUID userId = UUID.randomUUID();
        UUID transactionId = UUID.randomUUID();
        mockMvc.perform(post("/transactions")
                        .header(TraceIdFilter.USER_HEADER, userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"id": "%s", "amount": 18.75, "date": "2025-03-04", "type": "EXPENSE", "categoryId": "food"}
                                """.formatted(transactionId)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(transactionId.toString()))
                .andExpect(jsonPath("$.type").value("expense"));

        mockMvc.perform(get("/transactions")
                        .header(TraceIdFilter.USER_HEADER, userId.toString())
                        .param("from", "2025-03-01")
                        .param("to", "2025-03-31"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactions", hasSize(1)))
                .andExpect(jsonPath("$.period.from").value("2025-03-01"));

        mockMvc.perform(delete("/transactions/" + transactionId).header(TraceIdFilter.USER_HEADER, UUID.randomUUID().toString()))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/transactions/" + transactionId).header(TraceIdFilter.USER_HEADER, userId.toString()))
                .andExpect(status().isNoContent());
    }

    @Test
    void rejectsInvalidPayloads() throws Exception {
        mockMvc.perform(post("/transactions")
                        .header(TraceIdFilter.USER_HEADER, UUID.randomUUID().toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"date\": \"2025-03-04\", \"type\": \"expense\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/transactions")
                        .header(TraceIdFilter.USER_HEADER, UUID.randomUUID().toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 5, \"date\": \"2025-03-04\", \"type\": \"gift\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void categoryRegistrationRenamesBuckets() throws Exception {
        mockMvc.perform(put("/categories/pets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \" Pets \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Pets"));

        UUID userId = UUID.randomUUID();
        mockMvc.perform(post("/transactions")
                        .header(TraceIdFilter.USER_HEADER, userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"amount": 42, "date": "%s", "type": "expense", "categoryId": "pets"}
                                """.formatted(LocalDate.now())))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/reports/spending").header(TraceIdFilter.USER_HEADER, userId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.buckets[0].category").value("Pets"));
    }
}
