package com.brokerage.revshare.controller;

import com.brokerage.revshare.dto.AllowanceDto;
import com.brokerage.revshare.dto.RevenueShareDto;
import com.brokerage.revshare.service.RevenueShareService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/revenue-shares")
@RequiredArgsConstructor
@Tag(name = "Revenue Shares", description = "Revenue share ledger APIs")
public class RevenueShareController {

    private final RevenueShareService revenueShareService;

    @GetMapping
    @Operation(summary = "List revenue shares", description = "All revenue shares, newest first")
    public List<RevenueShareDto> getRevenueShares() {
        return revenueShareService.getRevenueShares();
    }

    @GetMapping("/allowance")
    @Operation(summary = "Annual allowance",
            description = "Cap, amount paid this calendar year and remaining allowance for a sponsor/source pair")
    public AllowanceDto getAllowance(@RequestParam Long recipientAgentId, @RequestParam Long sourceAgentId) {
        return revenueShareService.getAllowance(recipientAgentId, sourceAgentId);
    }
}
