package com.reclaimradar.config;

import org.bson.types.Decimal128;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class DecimalConvertersTest {

    @Test
    void amountKeepsItsScaleThroughDecimal128() {
        Decimal128 stored = new BigDecimalToDecimal128Converter().convert(new BigDecimal("47.90"));

        BigDecimal read = new Decimal128ToBigDecimalConverter().convert(stored);

        assertThat(read).isEqualTo(new BigDecimal("47.90"));
        assertThat(read.scale()).isEqualTo(2);
    }
}
