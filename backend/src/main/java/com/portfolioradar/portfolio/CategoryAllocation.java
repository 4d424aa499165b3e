package com.portfolioradar.portfolio;

import com.portfolioradar.domain.AssetCategory;

import java.math.BigDecimal;

/**
 * Share of current value held in one asset category. percentage is whole percent, 0 when the portfolio is worth 0.
 */
public record CategoryAllocation(AssetCategory category, BigDecimal value, BigDecimal percentage) {
}
