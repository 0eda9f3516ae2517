package com.esgcredit.scoring;

import com.esgcredit.config.Config;
import com.esgcredit.core.ConfigurationException;
import com.esgcredit.model.Grade;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GradeTableTest {
    private final GradeTable table = GradeTable.fromConfig(Config.defaults());

    @Test
    void resolve_shouldPutBoundaryValueInHigherBucket() {
        assertEquals(Grade.A_PLUS, table.resolve(90.0).grade);
        assertEquals(Grade.A, table.resolve(89.99).grade);
        assertEquals(Grade.A_MINUS, table.resolve(80.0).grade);
        assertEquals(Grade.B_PLUS, table.resolve(75.0).grade);
        assertEquals(Grade.C, table.resolve(64.99).grade);
    }

    @Test
    void resolve_shouldCoverBothEndsOfScoreRange() {
        assertEquals(Grade.A_PLUS, table.resolve(100.0).grade);
        assertEquals(Grade.C, table.resolve(0.0).grade);
        assertEquals(0.4, table.resolve(0.0).discountPct, 1e-9);
    }

    @Test
    void defaults_shouldBeContiguousAndExhaustive() {
        List<GradeBucket> buckets = table.buckets();
        assertEquals(7, buckets.size());
        assertEquals(100.0, buckets.get(0).upper, 1e-9);
        assertEquals(0.0, buckets.get(buckets.size() - 1).lower, 1e-9);
        for (int i = 1; i < buckets.size(); i++) {
            assertEquals(buckets.get(i - 1).lower, buckets.get(i).upper, 1e-9);
        }
    }

    @Test
    void discounts_shouldFollowDefaultTable() {
        assertEquals(2.7, table.discountFor(Grade.A_PLUS), 1e-9);
        assertEquals(1.8, table.discountFor(Grade.A_MINUS), 1e-9);
        assertEquals(1.3, table.discountFor(Grade.B_PLUS), 1e-9);
        assertEquals(0.8, table.discountFor(Grade.B_MINUS), 1e-9);
    }

    @Test
    void parse_shouldRejectGap() {
        assertThrows(ConfigurationException.class,
                () -> GradeTable.parse("A+:90-100:2.7,A:80-85:2.2,C:0-80:0.4"));
    }

    @Test
    void parse_shouldRejectOverlap() {
        assertThrows(ConfigurationException.class,
                () -> GradeTable.parse("A+:90-100:2.7,A:85-95:2.2,C:0-85:0.4"));
    }

    @Test
    void parse_shouldRejectTableNotReachingZeroOrHundred() {
        assertThrows(ConfigurationException.class, () -> GradeTable.parse("A+:90-99:2.7,C:0-90:0.4"));
        assertThrows(ConfigurationException.class, () -> GradeTable.parse("A+:90-100:2.7,C:10-90:0.4"));
    }

    @Test
    void parse_shouldRejectDuplicateOrUnknownLabel() {
        assertThrows(ConfigurationException.class, () -> GradeTable.parse("A+:90-100:2.7,A+:0-90:0.4"));
        assertThrows(ConfigurationException.class, () -> GradeTable.parse("Z:90-100:2.7,C:0-90:0.4"));
    }

    @Test
    void parse_shouldRejectMalformedEntry() {
        assertThrows(ConfigurationException.class, () -> GradeTable.parse("A+:90-100"));
        assertThrows(ConfigurationException.class, () -> GradeTable.parse("A+:ninety-100:2.7,C:0-90:0.4"));
        assertThrows(ConfigurationException.class, () -> GradeTable.parse(" "));
    }
}
