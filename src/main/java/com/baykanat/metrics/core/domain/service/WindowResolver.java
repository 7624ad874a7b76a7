package com.baykanat.metrics.core.domain.service;

import com.baykanat.metrics.core.domain.model.TimeRange;
import com.baykanat.metrics.core.domain.model.WindowPreset;
import com.baykanat.metrics.core.domain.model.rule.MetricThresholdRule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/** Threshold kuralının zaman aralığını çözer: açık start/end önce, yoksa preset "now"a göre. */
@Component
@RequiredArgsConstructor
public class WindowResolver {

    private final Clock clock;

    public TimeRange resolve(MetricThresholdRule rule) {
        if (rule.hasExplicitRange()) {
            return new TimeRange(rule.explicitStart(), rule.explicitEnd());
        }
        return resolve(rule.getWindow() != null ? rule.getWindow() : WindowPreset.ALL_TIME);
    }

    /** Bitiş her zaman "now" (hariç); all_time sınırsız. */
    public TimeRange resolve(WindowPreset preset) {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        return switch (preset) {
            case ALL_TIME -> TimeRange.unbounded();
            case LAST_7_DAYS -> new TimeRange(now.minus(7, ChronoUnit.DAYS), now);
            case LAST_30_DAYS -> new TimeRange(now.minus(30, ChronoUnit.DAYS), now);
            case LAST_90_DAYS -> new TimeRange(now.minus(90, ChronoUnit.DAYS), now);
            case MONTH_TO_DATE -> new TimeRange(today.withDayOfMonth(1).atStartOfDay(ZoneOffset.UTC).toInstant(), now);
            case YEAR_TO_DATE -> new TimeRange(today.withDayOfYear(1).atStartOfDay(ZoneOffset.UTC).toInstant(), now);
        };
    }
}
