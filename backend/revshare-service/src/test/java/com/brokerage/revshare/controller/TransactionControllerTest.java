package com.brokerage.revshare.controller;

import com.brokerage.revshare.dto.CreateTransactionRequest;
import com.brokerage.revshare.dto.TransactionDto;
import com.brokerage.revshare.dto.TransactionUpdateRequest;
import com.brokerage.revshare.entity.Transaction;
import com.brokerage.revshare.exception.ResourceNotFoundException;
import com.brokerage.revshare.service.RevenueShareService;
import com.brokerage.revshare.service.TransactionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TransactionController.class)
class TransactionControllerTest {

    private static final String VALID_BODY = "{"
            + "\"agentId\": 3,"
            + "\"propertyAddress\": \"12 Harbor View\","
            + "\"saleAmount\": 500000,"
            + "\"commissionPercentage\": 3,"
            + "\"companyGci\": 10000,"
            + "\"transactionDate\": \"2025-06-01\""
            + "}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TransactionService transactionService;

    @MockBean
    private RevenueShareService revenueShareService;

    @Test
    void create_returnsCreatedTransaction() throws Exception {
        Transaction transaction = Transaction.builder().id(7L).agentId(3L).build();
        when(transactionService.createTransaction(any(CreateTransactionRequest.class))).thenReturn(transaction);
        when(transactionService.toDto(transaction)).thenReturn(TransactionDto.builder()
                .id(7L).agentId(3L).companyGci(new BigDecimal("10000.00")).build());

        mockMvc.perform(post("/api/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.agentId").value(3));
    }

    @Test
    void create_withMissingFields_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agentId\": 3, \"saleAmount\": -5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").isNotEmpty());

        verify(transactionService, never()).createTransaction(any());
    }

    @Test
    void create_forUnknownAgent_isBadRequest() throws Exception {
        when(transactionService.createTransaction(any(CreateTransactionRequest.class)))
                .thenThrow(new IllegalArgumentException("Agent not found: 3"));

        mockMvc.perform(post("/api/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Agent not found: 3"));
    }

    @Test
    void update_ofMissingTransaction_isNotFound() throws Exception {
        when(transactionService.updateTransaction(eq(7L), any(TransactionUpdateRequest.class)))
                .thenReturn(Optional.empty());

        mockMvc.perform(put("/api/transactions/7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"companyGci\": 20000}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Transaction not found: 7"));
    }

    @Test
    void delete_returnsNoContent() throws Exception {
        when(transactionService.deleteTransaction(7L)).thenReturn(true);

        mockMvc.perform(delete("/api/transactions/7"))
                .andExpect(status().isNoContent());
    }

    @Test
    void delete_ofMissingTransaction_isNotFound() throws Exception {
        when(transactionService.deleteTransaction(7L)).thenReturn(false);

        mockMvc.perform(delete("/api/transactions/7"))
                .andExpect(status().isNotFound());
    }

    @Test
    void recalculate_ofMissingTransaction_isNotFound() throws Exception {
        when(transactionService.recalculateRevenueShares(7L)).thenThrow(ResourceNotFoundException.transaction(7L));

        mockMvc.perform(post("/api/transactions/7/revenue-shares/recalculate"))
                .andExpect(status().isNotFound());
    }

    @Test
    void revenueShares_areListedForTheTransaction() throws Exception {
        when(revenueShareService.getByTransaction(7L)).thenReturn(List.of());

        mockMvc.perform(get("/api/transactions/7/revenue-shares"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }
}
