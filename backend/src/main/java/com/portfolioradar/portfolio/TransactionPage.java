package com.portfolioradar.portfolio;

import com.portfolioradar.domain.TransactionRecord;

import java.util.List;

public record TransactionPage(List<TransactionRecord> items, int page, int size, long total) {

    public int totalPages() {
        return size == 0 ? 0 : (int) ((total + size - 1) / size);
    }
}
