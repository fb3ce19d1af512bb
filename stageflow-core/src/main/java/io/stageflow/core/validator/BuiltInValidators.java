package io.stageflow.core.validator;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Pattern;

/// Stock custom validators available to every process that opts in.
///
/// - `email_format`: a string containing `@` with a dot in the domain part
/// - `phone_format`: digits, spaces, dashes and parentheses, optional leading `+`
/// - `iso_date`: an ISO-8601 date, local date-time or offset date-time
///
/// All three ignore the lock's expected value and reject non-string input.
public final class BuiltInValidators {

    public static final String EMAIL_FORMAT = "email_format";
    public static final String PHONE_FORMAT = "phone_format";
    public static final String ISO_DATE = "iso_date";

    private static final Pattern PHONE_PATTERN = Pattern.compile("^\\+?[\\d\\s\\-()]+$");

    private BuiltInValidators() {}

    /// Returns definitions for all stock validators.
    ///
    /// @return unmodifiable list, never null
    public static List<ValidatorDefinition> all() {
        return List.of(
                new ValidatorDefinition(
                        EMAIL_FORMAT, "Validate basic email format", BuiltInValidators::isEmail),
                new ValidatorDefinition(
                        PHONE_FORMAT, "Validate phone number format", BuiltInValidators::isPhone),
                new ValidatorDefinition(
                        ISO_DATE, "Validate ISO date format", BuiltInValidators::isIsoDate));
    }

    /// Registers every stock validator, replacing same-named entries.
    ///
    /// @param registry target registry, not null
    public static void registerAll(ValidatorRegistry registry) {
        all().forEach(registry::register);
    }

    static boolean isEmail(Object value, Object expected) {
        if (!(value instanceof String s)) {
            return false;
        }
        int at = s.lastIndexOf('@');
        return at >= 0 && s.substring(at + 1).contains(".");
    }

    static boolean isPhone(Object value, Object expected) {
        return value instanceof String s && PHONE_PATTERN.matcher(s).find();
    }

    static boolean isIsoDate(Object value, Object expected) {
        if (!(value instanceof String s)) {
            return false;
        }
        String text = s.endsWith("Z") ? s.substring(0, s.length() - 1) + "+00:00" : s;
        return parses(() -> LocalDate.parse(text))
                || parses(() -> LocalDateTime.parse(text))
                || parses(() -> OffsetDateTime.parse(text));
    }

    private static boolean parses(Runnable parse) {
        try {
            parse.run();
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
