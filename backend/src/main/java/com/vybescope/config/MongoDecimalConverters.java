package com.vybescope.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigDecimal;
import java.util.List;

/**
 * BigDecimal ↔ Decimal128 for dashboard documents. Without them Spring Data writes whale thresholds
 * as strings, which breaks numeric comparison in queries.
 */
final class MongoDecimalConverters {

    private MongoDecimalConverters() {
    }

    static List<Converter<?, ?>> all() {
        return List.of(ThresholdWriter.INSTANCE, ThresholdReader.INSTANCE);
    }

    @WritingConverter
    enum ThresholdWriter implements Converter<BigDecimal, Decimal128> {
        INSTANCE;

        @Override
        public Decimal128 convert(BigDecimal source) {
            return new Decimal128(source);
        }
    }

    @ReadingConverter
    enum ThresholdReader implements Converter<Decimal128, BigDecimal> {
        INSTANCE;

        @Override
        public BigDecimal convert(Decimal128 source) {
            return source.bigDecimalValue();
        }
    }
}
