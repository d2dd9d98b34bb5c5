package com.eainde.planner.model;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Monday-start day names of the planning week.
 */
public final class Weekdays {

    private Weekdays() {}

    /** English name of day 1..7, Monday first. */
    public static String nameOf(int day) {
        return DayOfWeek.of(day).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    public static List<String> names() {
        List<String> names = new ArrayList<>(7);
        for (DayOfWeek dow : DayOfWeek.values()) {
            names.add(dow.getDisplayName(TextStyle.FULL, Locale.ENGLISH));
        }
        return List.copyOf(names);
    }
}
