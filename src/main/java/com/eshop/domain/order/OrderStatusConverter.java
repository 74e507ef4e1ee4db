package com.eshop.domain.order;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * orders.status 컬럼 <-> OrderStatus 변환 (문자열 태그로 저장)
 */
@Converter
public class OrderStatusConverter implements AttributeConverter<OrderStatus, String> {

    @Override
    public String convertToDatabaseColumn(OrderStatus status) {
        return status == null ? null : status.getValue();
    }

    @Override
    public OrderStatus convertToEntityAttribute(String value) {
        return value == null ? null : OrderStatus.fromValue(value);
    }
}
