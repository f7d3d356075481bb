package com.measurestore.period;

import com.measurestore.contract.InvalidPeriodException;
import com.measurestore.store.MeasureStore;
import com.measurestore.store.UniqueKeyConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Turns raw (kind, date?, year?, time?) input into a deduplicated {@link Period}.
 *
 * <p>Exactly one value field may be present and it must match {@code kind}. Dates are
 * accepted as ISO {@code yyyy-MM-dd} and stored as {@link LocalDate}, so two spellings of
 * the same day resolve to one period.
 */
@Service
public class PeriodResolver {

    private static final Logger log = LoggerFactory.getLogger(PeriodResolver.class);

    private final MeasureStore store;

    public PeriodResolver(MeasureStore store) {
        this.store = store;
    }

    public Period resolvePeriod(PeriodKind kind, String dateValue, Integer yearValue, Double timeValue) {
        return resolve(toValue(kind, dateValue, yearValue, timeValue));
    }

    public Period resolve(PeriodValue value) {
        Optional<Period> existing = store.findPeriod(value);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            Period created = store.insertPeriod(value);
            log.info("Created period id={} kind={} value={}", created.id(), created.kind().getValue(), created.displayValue());
            return created;
        } catch (UniqueKeyConflictException ex) {
            // another caller inserted the same period between our lookup and insert
            return store.findPeriod(ex.getExistingId())
                .orElseThrow(() -> new IllegalStateException("period vanished after conflict: " + ex.getExistingId()));
        }
    }

    public Optional<Period> findPeriod(long id) {
        return store.findPeriod(id);
    }

    public Optional<Period> findPeriod(PeriodValue value) {
        return store.findPeriod(value);
    }

    /**
     * Validates the raw fields and builds the matching variant.
     */
    public PeriodValue toValue(PeriodKind kind, String dateValue, Integer yearValue, Double timeValue) {
        if (kind == null) {
            throw new InvalidPeriodException("period kind is required");
        }
        int populated = (dateValue != null ? 1 : 0) + (yearValue != null ? 1 : 0) + (timeValue != null ? 1 : 0);
        if (populated != 1) {
            throw new InvalidPeriodException(
                "exactly one of date_value, year_value, time_value must be set, got " + populated);
        }
        return switch (kind) {
            case DATE -> {
                if (dateValue == null) {
                    throw new InvalidPeriodException("kind=date requires date_value");
                }
                yield new DatePeriod(parseDate(dateValue));
            }
            case YEAR -> {
                if (yearValue == null) {
                    throw new InvalidPeriodException("kind=year requires year_value");
                }
                yield new YearPeriod(yearValue);
            }
            case TIME -> {
                if (timeValue == null) {
                    throw new InvalidPeriodException("kind=time requires time_value");
                }
                yield new TimeIndexPeriod(timeValue);
            }
        };
    }

    private LocalDate parseDate(String raw) {
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            throw new InvalidPeriodException("date_value must be an ISO date (yyyy-MM-dd), got '" + raw + "'");
        }
    }
}
