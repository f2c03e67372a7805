package com.tdnet.ingestion.service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public final class ScrapeDates {

    private static final DateTimeFormatter BASIC = DateTimeFormatter.BASIC_ISO_DATE;

    private ScrapeDates() {
    }

    public static LocalDate parse(String date) {
        if (date == null || !date.matches("\\d{8}")) {
            throw new IllegalArgumentException("Date must be YYYYMMDD: " + date);
        }
        try {
            return LocalDate.parse(date, BASIC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date: " + date, e);
        }
    }

    public static String format(LocalDate date) {
        return date.format(BASIC);
    }

    /**
     * Inclusive list of {@code YYYYMMDD} dates from {@code start} to {@code end}.
     */
    public static List<String> between(String start, String end) {
        LocalDate from = parse(start);
        LocalDate to = parse(end);
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("endDate " + end + " is before startDate " + start);
        }
        List<String> dates = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            dates.add(format(day));
        }
        return dates;
    }
}
