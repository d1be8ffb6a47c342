package com.takeaway.storefront.util;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Stores timestamps as {@code yyyy-MM-dd HH:mm:ss} text, which SQLite sorts correctly.
 */
@Converter
public class LocalDateTimeConverter implements AttributeConverter<LocalDateTime, String> {

    private static final Logger logger = LoggerFactory.getLogger(LocalDateTimeConverter.class);
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public String convertToDatabaseColumn(LocalDateTime localDateTime) {
        if (localDateTime == null) {
            return null;
        }
        return localDateTime.format(FORMATTER);
    }

    @Override
    public LocalDateTime convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.trim().isEmpty()) {
            return null;
        }
        try {
            return LocalDateTime.parse(dbData, FORMATTER);
        } catch (DateTimeParseException e) {
            // rows written by other tools may use the ISO 'T' separator
            try {
                return LocalDateTime.parse(dbData.trim().replace(' ', 'T'));
            } catch (DateTimeParseException e2) {
                logger.warn("Unparseable timestamp in database: {}", dbData);
                return null;
            }
        }
    }
}
