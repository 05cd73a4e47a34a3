package com.qrwallet.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stores a list of epoch-millisecond timestamps as a comma separated string.
 */
@Converter
public class EpochMillisListConverter implements AttributeConverter<List<Long>, String> {

    @Override
    public String convertToDatabaseColumn(List<Long> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return "";
        }
        return attribute.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    @Override
    public List<Long> convertToEntityAttribute(String dbData) {
        List<Long> timestamps = new ArrayList<>();
        if (dbData == null || dbData.isBlank()) {
            return timestamps;
        }
        for (String part : dbData.split(",")) {
            timestamps.add(Long.parseLong(part.trim()));
        }
        return timestamps;
    }
}
