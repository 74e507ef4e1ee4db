package com.eshop.domain.order;

import com.eshop.common.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * OrderStatus - 주문 생명주기 상태
 *
 * 상태 전환 규칙:
 * PENDING → CONFIRMED → SHIPPED → DELIVERED
 * PENDING → CANCELLED
 * CONFIRMED → CANCELLED
 *
 * DELIVERED, CANCELLED는 종료 상태입니다.
 */
public enum OrderStatus {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    SHIPPED("shipped"),
    DELIVERED("delivered"),
    CANCELLED("cancelled");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 현재 상태에서 전환 가능한 다음 상태 목록
     */
    public Set<OrderStatus> nextStatuses() {
        switch (this) {
            case PENDING:
                return Collections.unmodifiableSet(EnumSet.of(CONFIRMED, CANCELLED));
            case CONFIRMED:
                return Collections.unmodifiableSet(EnumSet.of(SHIPPED, CANCELLED));
            case SHIPPED:
                return Collections.unmodifiableSet(EnumSet.of(DELIVERED));
            default:
                return Collections.emptySet();
        }
    }

    public boolean canTransitionTo(OrderStatus target) {
        return target != null && nextStatuses().contains(target);
    }

    public boolean isTerminal() {
        return nextStatuses().isEmpty();
    }

    /**
     * 배송지 변경이 가능한 상태인지 (출고 전)
     */
    public boolean isShippingAddressEditable() {
        return this == PENDING || this == CONFIRMED;
    }

    /**
     * 문자열 태그에서 OrderStatus로 변환
     */
    @JsonCreator
    public static OrderStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new ValidationException("유효하지 않은 주문 상태입니다: " + value));
    }
}
