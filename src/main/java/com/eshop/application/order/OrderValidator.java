package com.eshop.application.order;

import com.eshop.application.order.dto.CreateOrderCommand;
import com.eshop.application.order.dto.OrderItemCommand;
import com.eshop.common.exception.ValidationException;
import com.eshop.domain.order.OrderConstants;
import org.springframework.stereotype.Component;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * OrderValidator - 주문 생성 요청 검증 (트랜잭션 진입 전)
 *
 * 책임:
 * - 배송지 길이, 항목 존재, product_id/수량 범위 검증
 * - 같은 상품 중복 항목 병합 (수량 합산)
 * - 상품 ID 오름차순 정렬 (락 획득 순서 고정으로 데드락 방지)
 */
@Component
public class OrderValidator {

    /**
     * @return productId → 수량 (productId 오름차순)
     */
    public SortedMap<Long, Integer> validateAndMerge(CreateOrderCommand command) {
        validateShippingAddress(command.getShippingAddress());
        if (command.getItems() == null || command.getItems().isEmpty()) {
            throw new ValidationException(OrderConstants.MSG_EMPTY_ITEMS);
        }

        SortedMap<Long, Integer> lines = new TreeMap<>();
        for (OrderItemCommand item : command.getItems()) {
            if (item == null || item.getProductId() == null || item.getProductId() <= 0) {
                throw new ValidationException("product_id는 양의 정수여야 합니다");
            }
            validateQuantity(item.getQuantity());
            int merged = lines.getOrDefault(item.getProductId(), 0) + item.getQuantity();
            validateQuantity(merged);
            lines.put(item.getProductId(), merged);
        }
        return lines;
    }

    public void validateShippingAddress(String shippingAddress) {
        if (shippingAddress == null) {
            throw new ValidationException(OrderConstants.MSG_INVALID_SHIPPING_ADDRESS);
        }
        int length = shippingAddress.trim().length();
        if (length < OrderConstants.MIN_SHIPPING_ADDRESS_LENGTH || length > OrderConstants.MAX_SHIPPING_ADDRESS_LENGTH) {
            throw new ValidationException(OrderConstants.MSG_INVALID_SHIPPING_ADDRESS);
        }
    }

    private void validateQuantity(Integer quantity) {
        if (quantity == null
                || quantity < OrderConstants.MIN_ITEM_QUANTITY
                || quantity > OrderConstants.MAX_ITEM_QUANTITY) {
            throw new ValidationException(OrderConstants.MSG_INVALID_QUANTITY);
        }
    }
}
