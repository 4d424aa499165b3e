package com.portfolioradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.List;

/**
 * MongoDB configuration: Decimal128 codec for every quantity, price and amount field.
 * Unique indexes (holdings per symbol, one snapshot per asset and date) come from the @Indexed / @CompoundIndex
 * annotations on the documents; spring.data.mongodb.auto-index-creation must stay enabled.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(
                new BigDecimalToDecimal128Converter(),
                new Decimal128ToBigDecimalConverter()
        ));
    }
}
