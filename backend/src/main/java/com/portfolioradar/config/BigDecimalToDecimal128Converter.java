package com.portfolioradar.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Writes BigDecimal quantities and amounts as Decimal128. Decimal128 holds at most 34 significant digits; engines keep
 * products at scale 18, and anything still wider is rounded half-up to 34 digits instead of failing the write.
 */
@WritingConverter
public class BigDecimalToDecimal128Converter implements Converter<BigDecimal, Decimal128> {

    static final MathContext DECIMAL128_PRECISION = new MathContext(34, RoundingMode.HALF_UP);

    @Override
    public Decimal128 convert(BigDecimal source) {
        BigDecimal value = source.precision() > DECIMAL128_PRECISION.getPrecision()
                ? source.round(DECIMAL128_PRECISION)
                : source;
        return new Decimal128(value);
    }
}
