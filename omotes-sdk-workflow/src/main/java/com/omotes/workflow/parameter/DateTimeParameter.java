package com.omotes.workflow.parameter;

import com.fasterxml.jackson.databind.JsonNode;
import com.omotes.protocol.ProtocolException;
import com.omotes.protocol.workflow.DateTimeParameterMessage;
import com.omotes.protocol.workflow.WorkflowParameterMessage;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Date-and-time parameter. Runtime values are {@link LocalDateTime} in the system default zone;
 * on the wire they are seconds since the epoch as a double. The catalog carries the default as
 * an ISO-8601 local date-time string.
 */
public final class DateTimeParameter extends WorkflowParameter {

    private static final String TYPE = "DateTimeParameter";

    private final LocalDateTime defaultValue;

    public DateTimeParameter(String keyName, String title, String description, LocalDateTime defaultValue) {
        super(keyName, title, description);
        this.defaultValue = defaultValue;
    }

    public LocalDateTime getDefaultValue() {
        return defaultValue;
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.DATETIME;
    }

    public static DateTimeParameter fromJsonConfig(JsonNode config) {
        String keyName = requiredText(config, "key_name", TYPE);
        JsonNode defaultNode = config.get("default");
        LocalDateTime defaultValue = null;
        if (defaultNode != null) {
            if (!defaultNode.isTextual()) {
                throw new WrongFieldTypeException("Invalid default datetime format, should be a string in ISO format: '"
                        + defaultNode.asText() + "'");
            }
            defaultValue = parseIso(defaultNode.textValue());
            if (defaultValue == null) {
                throw new WrongFieldTypeException("Invalid default datetime format, should be a string in ISO format: '"
                        + defaultNode.textValue() + "'");
            }
        }
        return new DateTimeParameter(
                keyName,
                optionalText(config, "title", TYPE),
                optionalText(config, "description", TYPE),
                defaultValue);
    }

    /**
     * @throws ProtocolException when the default is not an ISO-8601 date-time
     */
    public static DateTimeParameter fromWireMessage(WorkflowParameterMessage message) {
        DateTimeParameterMessage variant = message.getDatetimeParameter();
        LocalDateTime defaultValue = null;
        if (variant.hasDefault()) {
            defaultValue = parseIso(variant.getDefaultValue());
            if (defaultValue == null) {
                throw new ProtocolException("Invalid default datetime format, should be a string in ISO format: "
                        + variant.getDefaultValue());
            }
        }
        return new DateTimeParameter(message.getKeyName(), message.getTitle(), message.getDescription(), defaultValue);
    }

    @Override
    public WorkflowParameterMessage toWireMessage() {
        String isoDefault = defaultValue != null ? DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(defaultValue) : null;
        return WorkflowParameterMessage.of(getKeyName(), getTitle(), getDescription(),
                new DateTimeParameterMessage(isoDefault));
    }

    /** ISO date, optionally followed by 'T' or a space, a time and a UTC offset. */
    private static final DateTimeFormatter CONFIG_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendPattern("['T'][ ]")
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    /**
     * Parses a date, a local date-time or a date-time with offset. A date is taken at the start of the
     * day; an offset date-time is converted to the system default zone. Null when the text does not parse.
     */
    static LocalDateTime parseIso(String text) {
        TemporalAccessor parsed;
        try {
            parsed = CONFIG_FORMAT.parseBest(text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            return null;
        }
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
        }
        if (parsed instanceof LocalDate) {
            return ((LocalDate) parsed).atStartOfDay();
        }
        return (LocalDateTime) parsed;
    }

    static Double dateTimeToWire(Object value) {
        if (value instanceof LocalDateTime) {
            Instant instant = ((LocalDateTime) value).atZone(ZoneId.systemDefault()).toInstant();
            return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
        }
        throw new WrongFieldTypeException("Cannot convert value \"" + value + "\" to a wire value as the type is "
                + describe(value) + " while a datetime was expected.");
    }

    static LocalDateTime dateTimeFromWire(Object value) {
        if (value instanceof Double) {
            double seconds = (Double) value;
            if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
                throw new WrongFieldTypeException("Cannot convert value \"" + value + "\" from a wire timestamp as it is not finite.");
            }
            long wholeSeconds = (long) Math.floor(seconds);
            long nanos = Math.round((seconds - wholeSeconds) * 1_000_000_000L);
            if (nanos >= 1_000_000_000L) {
                wholeSeconds++;
                nanos = 0;
            }
            return LocalDateTime.ofInstant(Instant.ofEpochSecond(wholeSeconds, nanos), ZoneId.systemDefault());
        }
        throw new WrongFieldTypeException("Cannot convert value \"" + value + "\" from a wire value as the type is "
                + describe(value) + " while a float was expected.");
    }
}
