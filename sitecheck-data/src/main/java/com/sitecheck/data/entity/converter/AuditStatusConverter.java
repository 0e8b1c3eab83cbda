package com.sitecheck.data.entity.converter;

import com.sitecheck.common.constants.AuditStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class AuditStatusConverter implements AttributeConverter<AuditStatus, String> {

    @Override
    public String convertToDatabaseColumn(AuditStatus status) {
        return status != null ? status.getValue() : null;
    }

    @Override
    public AuditStatus convertToEntityAttribute(String value) {
        return value != null ? AuditStatus.fromValue(value) : null;
    }
}
