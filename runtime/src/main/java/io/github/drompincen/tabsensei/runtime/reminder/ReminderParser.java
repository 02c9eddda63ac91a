package io.github.drompincen.tabsensei.runtime.reminder;

import io.github.drompincen.tabsensei.protocol.api.ReminderIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PARSE step. Prefers the structured intent from the reasoning service and falls back to the
 * wording of the query for whatever the intent leaves out.
 */
@Component
public class ReminderParser {

    private static final Logger log = LoggerFactory.getLogger(ReminderParser.class);

    private static final String UNIT = "(seconds?|secs?|s|minutes?|mins?|m|hours?|hrs?|h)";
    private static final String CLOCK = "(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?";

    private static final Pattern IN_THEN_TEXT = Pattern.compile(
            "remind me in (\\d+)\\s*" + UNIT + "\\s+(?:to|about)\\s+(.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TEXT_THEN_IN = Pattern.compile(
            "remind me (?:to|about)\\s+(.+?)\\s+in (\\d+)\\s*" + UNIT + "\\b.*", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAILY_AT = Pattern.compile(
            "remind me (?:every day|daily) at " + CLOCK + "\\s+(?:to|about)\\s+(.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern AT = Pattern.compile(
            "remind me at " + CLOCK + "\\s+(?:to|about)\\s+(.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern RECURRING_HINT = Pattern.compile("\\b(every day|daily|each day)\\b",
            Pattern.CASE_INSENSITIVE);

    private final Clock clock;

    public ReminderParser(Clock clock) {
        this.clock = clock;
    }

    public Optional<ReminderRequest> parse(ReminderIntent intent, String query) {
        Instant now = clock.instant();
        Optional<ReminderRequest> fromQuery = parseQuerySafely(query, now);
        if (intent == null) return fromQuery;

        String text = blankToNull(intent.text());
        if (text == null) text = fromQuery.map(ReminderRequest::text).orElse(null);
        if (text == null) return Optional.empty();

        boolean recurring = intent.recurring()
                || (query != null && RECURRING_HINT.matcher(query).find());

        Instant fireAt;
        if (intent.fireAt() != null) {
            fireAt = intent.fireAt();
        } else if (intent.delaySeconds() != null) {
            fireAt = now.plusSeconds(intent.delaySeconds());
        } else if (blankToNull(intent.timeOfDay()) != null) {
            Optional<LocalTime> time = timeOfDay(intent.timeOfDay());
            if (time.isEmpty()) return Optional.empty();
            fireAt = todayAt(time.get(), now);
        } else {
            fireAt = fromQuery.map(ReminderRequest::fireAt).orElse(null);
        }
        if (fireAt == null) return Optional.empty();
        return Optional.of(new ReminderRequest(text, fireAt, recurring));
    }

    private Optional<ReminderRequest> parseQuerySafely(String query, Instant now) {
        try {
            return parseQuery(query, now);
        } catch (DateTimeException e) {
            log.warn("Ignoring impossible time in '{}': {}", query, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<LocalTime> timeOfDay(String raw) {
        try {
            return Optional.of(LocalTime.parse(raw.trim()));
        } catch (DateTimeException e) {
            log.warn("Ignoring unreadable time of day '{}': {}", raw, e.getMessage());
            return Optional.empty();
        }
    }

    Optional<ReminderRequest> parseQuery(String query, Instant now) {
        if (query == null) return Optional.empty();
        String q = query.trim();

        Matcher m = IN_THEN_TEXT.matcher(q);
        if (m.matches()) {
            return Optional.of(new ReminderRequest(cleanText(m.group(3)),
                    now.plus(duration(Long.parseLong(m.group(1)), m.group(2))), false));
        }
        m = TEXT_THEN_IN.matcher(q);
        if (m.matches()) {
            return Optional.of(new ReminderRequest(cleanText(m.group(1)),
                    now.plus(duration(Long.parseLong(m.group(2)), m.group(3))), false));
        }
        m = DAILY_AT.matcher(q);
        if (m.matches()) {
            return Optional.of(new ReminderRequest(cleanText(m.group(4)),
                    todayAt(clockTime(m.group(1), m.group(2), m.group(3)), now), true));
        }
        m = AT.matcher(q);
        if (m.matches()) {
            return Optional.of(new ReminderRequest(cleanText(m.group(4)),
                    todayAt(clockTime(m.group(1), m.group(2), m.group(3)), now), false));
        }
        return Optional.empty();
    }

    private Instant todayAt(LocalTime time, Instant now) {
        LocalDate today = now.atZone(clock.getZone()).toLocalDate();
        return ZonedDateTime.of(today, time, clock.getZone()).toInstant();
    }

    private static LocalTime clockTime(String hours, String minutes, String meridiem) {
        int h = Integer.parseInt(hours);
        int min = minutes != null ? Integer.parseInt(minutes) : 0;
        if (meridiem != null) {
            boolean pm = meridiem.equalsIgnoreCase("pm");
            if (h == 12) h = pm ? 12 : 0;
            else if (pm) h += 12;
        }
        return LocalTime.of(h % 24, min);
    }

    private static Duration duration(long amount, String unit) {
        String u = unit.toLowerCase(Locale.ROOT);
        if (u.startsWith("h")) return Duration.ofHours(amount);
        if (u.startsWith("m")) return Duration.ofMinutes(amount);
        return Duration.ofSeconds(amount);
    }

    private static String cleanText(String raw) {
        String text = raw.trim();
        while (text.endsWith(".") || text.endsWith("!")) text = text.substring(0, text.length() - 1).trim();
        return text;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
