package com.sitecheck.data.entity.converter;

import com.sitecheck.common.constants.QueueStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class QueueStatusConverter implements AttributeConverter<QueueStatus, String> {

    @Override
    public String convertToDatabaseColumn(QueueStatus status) {
        return status != null ? status.getValue() : null;
    }

    @Override
    public QueueStatus convertToEntityAttribute(String value) {
        return value != null ? QueueStatus.fromValue(value) : null;
    }
}
