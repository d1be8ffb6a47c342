package com.takeaway.storefront.controller;

import com.takeaway.storefront.dto.SalesSummary;
import com.takeaway.storefront.service.SalesSummaryService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/summary")
@PreAuthorize("hasRole('ADMIN')")
public class AdminSummaryController {

    private final SalesSummaryService salesSummaryService;

    public AdminSummaryController(SalesSummaryService salesSummaryService) {
        this.salesSummaryService = salesSummaryService;
    }

    @PostMapping("/run")
    public ResponseEntity<SalesSummary> runSummary() {
        return ResponseEntity.ok(salesSummaryService.runSummary());
    }
}
