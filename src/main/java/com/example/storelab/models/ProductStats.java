package com.example.storelab.models;

import java.math.BigDecimal;

/**
 * Products sharing one category (null category forms its own group).
 */
public record ProductStats(String category, long count, BigDecimal avgPrice, long totalQuantity) {
}
