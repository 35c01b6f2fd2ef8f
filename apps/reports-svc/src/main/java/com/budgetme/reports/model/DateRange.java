package com.budgetme.reports.model;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Inclusive date range; either bound may be open.
 */
public record DateRange(Optional<LocalDate> from, Optional<LocalDate> to) {

    public DateRange {
        from = from == null ? Optional.empty() : from;
        to = to == null ? Optional.empty() : to;
        if (from.isPresent() && to.isPresent() && to.get().isBefore(from.get())) {
            throw new IllegalArgumentException("to must not be before from");
        }
    }

    public static DateRange unbounded() {
        return new DateRange(Optional.empty(), Optional.empty());
    }

    public static DateRange since(LocalDate from) {
        return new DateRange(Optional.of(from), Optional.empty());
    }

    public static DateRange between(LocalDate from, LocalDate to) {
        return new DateRange(Optional.ofNullable(from), Optional.ofNullable(to));
    }

    public boolean contains(LocalDate date) {
        if (from.isPresent() && date.isBefore(from.get())) {
            return false;
        }
        return to.isEmpty() || !date.isAfter(to.get());
    }
}
