package com.uniclass.gateway.quota;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;

/**
 * 配额计费周期（UTC 自然月）。
 */
public final class QuotaPeriods {

    private QuotaPeriods() {
    }

    public static YearMonth currentMonth(Clock clock) {
        return YearMonth.from(clock.instant().atZone(ZoneOffset.UTC));
    }

    /**
     * 下个自然月第一刻（UTC）。
     */
    public static Instant resetDate(Clock clock) {
        return currentMonth(clock).plusMonths(1).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
