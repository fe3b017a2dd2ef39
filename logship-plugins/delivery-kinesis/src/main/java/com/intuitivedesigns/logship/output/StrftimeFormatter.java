/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.output;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Formats instants with a C {@code strftime} pattern, compiled once.
 *
 * <p>Supported conversions: {@code %Y %y %m %d %e %H %I %M %S %p %j %a %A %b %h %B
 * %Z %z %s %F %T %D %R %n %t %%}, plus {@code %L} (milliseconds) and {@code %f}
 * (microseconds). Any other conversion is copied to the output unchanged.
 * Names are English, as in the C locale.</p>
 */
public final class StrftimeFormatter {

    @FunctionalInterface
    private interface Part {
        void append(ZonedDateTime t, StringBuilder out);
    }

    private final String pattern;
    private final ZoneId zone;
    private final List<Part> parts;

    private StrftimeFormatter(String pattern, ZoneId zone, List<Part> parts) {
        this.pattern = pattern;
        this.zone = zone;
        this.parts = parts;
    }

    public static StrftimeFormatter compile(String pattern) {
        return compile(pattern, ZoneOffset.UTC);
    }

    public static StrftimeFormatter compile(String pattern, ZoneId zone) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(zone, "zone");

        final List<Part> parts = new ArrayList<>();
        final StringBuilder literal = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            final char c = pattern.charAt(i);
            if (c != '%' || i + 1 >= pattern.length()) {
                literal.append(c);
                continue;
            }
            final char conv = pattern.charAt(++i);
            final Part part = conversion(conv);
            if (part == null) {
                literal.append('%').append(conv);
                continue;
            }
            if (literal.length() > 0) {
                final String text = literal.toString();
                parts.add((t, out) -> out.append(text));
                literal.setLength(0);
            }
            parts.add(part);
        }
        if (literal.length() > 0) {
            final String text = literal.toString();
            parts.add((t, out) -> out.append(text));
        }
        return new StrftimeFormatter(pattern, zone, List.copyOf(parts));
    }

    public String format(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        final ZonedDateTime t = instant.atZone(zone);
        final StringBuilder out = new StringBuilder(32);
        for (Part p : parts) {
            p.append(t, out);
        }
        return out.toString();
    }

    public String pattern() {
        return pattern;
    }

    private static Part conversion(char conv) {
        switch (conv) {
            case 'Y': return (t, out) -> out.append(t.getYear());
            case 'y': return (t, out) -> pad(out, Math.floorMod(t.getYear(), 100), 2, '0');
            case 'm': return (t, out) -> pad(out, t.getMonthValue(), 2, '0');
            case 'd': return (t, out) -> pad(out, t.getDayOfMonth(), 2, '0');
            case 'e': return (t, out) -> pad(out, t.getDayOfMonth(), 2, ' ');
            case 'H': return (t, out) -> pad(out, t.getHour(), 2, '0');
            case 'I': return (t, out) -> pad(out, hour12(t.getHour()), 2, '0');
            case 'M': return (t, out) -> pad(out, t.getMinute(), 2, '0');
            case 'S': return (t, out) -> pad(out, t.getSecond(), 2, '0');
            case 'L': return (t, out) -> pad(out, t.getNano() / 1_000_000, 3, '0');
            case 'f': return (t, out) -> pad(out, t.getNano() / 1_000, 6, '0');
            case 'p': return (t, out) -> out.append(t.getHour() < 12 ? "AM" : "PM");
            case 'j': return (t, out) -> pad(out, t.getDayOfYear(), 3, '0');
            case 'a': return (t, out) -> out.append(t.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.US));
            case 'A': return (t, out) -> out.append(t.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.US));
            case 'b':
            case 'h': return (t, out) -> out.append(t.getMonth().getDisplayName(TextStyle.SHORT, Locale.US));
            case 'B': return (t, out) -> out.append(t.getMonth().getDisplayName(TextStyle.FULL, Locale.US));
            case 'Z': return (t, out) -> out.append(t.getZone().getDisplayName(TextStyle.SHORT, Locale.US));
            case 'z': return StrftimeFormatter::offset;
            case 's': return (t, out) -> out.append(t.toEpochSecond());
            case 'F': return sequence(conversion('Y'), literal('-'), conversion('m'), literal('-'), conversion('d'));
            case 'T': return sequence(conversion('H'), literal(':'), conversion('M'), literal(':'), conversion('S'));
            case 'R': return sequence(conversion('H'), literal(':'), conversion('M'));
            case 'D': return sequence(conversion('m'), literal('/'), conversion('d'), literal('/'), conversion('y'));
            case 'n': return literal('\n');
            case 't': return literal('\t');
            case '%': return literal('%');
            default:  return null;
        }
    }

    private static Part literal(char c) {
        return (t, out) -> out.append(c);
    }

    private static Part sequence(Part... parts) {
        return (t, out) -> {
            for (Part p : parts) {
                p.append(t, out);
            }
        };
    }

    private static void offset(ZonedDateTime t, StringBuilder out) {
        final int total = t.getOffset().getTotalSeconds();
        out.append(total < 0 ? '-' : '+');
        final int abs = Math.abs(total);
        pad(out, abs / 3600, 2, '0');
        pad(out, (abs / 60) % 60, 2, '0');
    }

    private static int hour12(int hour) {
        final int h = hour % 12;
        return h == 0 ? 12 : h;
    }

    private static void pad(StringBuilder out, int value, int width, char fill) {
        final String digits = Integer.toString(value);
        for (int i = digits.length(); i < width; i++) {
            out.append(fill);
        }
        out.append(digits);
    }
}
