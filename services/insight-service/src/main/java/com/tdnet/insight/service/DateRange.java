package com.tdnet.insight.service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

final class DateRange {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private DateRange() {
    }

    /**
     * Every {@code yyyyMMdd} date from {@code start} to {@code end}, both inclusive.
     */
    static List<String> between(String start, String end) {
        LocalDate from = parse(start);
        LocalDate to = parse(end);
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("endDate " + end + " is before startDate " + start);
        }
        List<String> dates = new ArrayList<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            dates.add(date.format(FORMAT));
        }
        return dates;
    }

    static LocalDate parse(String value) {
        if (value == null || !value.matches("\\d{8}")) {
            throw new IllegalArgumentException("Expected a yyyyMMdd date but got: " + value);
        }
        try {
            return LocalDate.parse(value, FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not a calendar date: " + value, e);
        }
    }
}
