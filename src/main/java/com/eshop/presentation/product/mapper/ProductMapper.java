package com.eshop.presentation.product.mapper;

import com.eshop.application.product.dto.CreateProductCommand;
import com.eshop.application.product.dto.ProductResult;
import com.eshop.application.product.dto.ProductSummaryResult;
import com.eshop.application.product.dto.UpdateProductCommand;
import com.eshop.presentation.product.request.ProductCreateRequest;
import com.eshop.presentation.product.request.ProductUpdateRequest;
import com.eshop.presentation.product.response.ProductListResponse;
import com.eshop.presentation.product.response.ProductResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ProductMapper - Presentation layer와 Application layer 간의 DTO 변환
 *
 * 책임:
 * - Presentation Request DTO → Application Command 변환
 * - Application Result → Presentation Response DTO 변환
 */
@Component
public class ProductMapper {

    public CreateProductCommand toCreateProductCommand(ProductCreateRequest request) {
        return CreateProductCommand.builder()
                .name(request.getName())
                .description(request.getDescription())
                .price(request.getPrice())
                .stockQuantity(request.getStockQuantity())
                .categoryId(request.getCategoryId())
                .imageUrl(request.getImageUrl())
                .isActive(request.getIsActive())
                .build();
    }

    public UpdateProductCommand toUpdateProductCommand(ProductUpdateRequest request) {
        return UpdateProductCommand.builder()
                .name(request.getName())
                .description(request.getDescription())
                .price(request.getPrice())
                .stockQuantity(request.getStockQuantity())
                .categoryId(request.getCategoryId())
                .imageUrl(request.getImageUrl())
                .isActive(request.getIsActive())
                .build();
    }

    public ProductResponse toProductResponse(ProductResult result) {
        return ProductResponse.builder()
                .id(result.getId())
                .name(result.getName())
                .description(result.getDescription())
                .price(result.getPrice())
                .stockQuantity(result.getStockQuantity())
                .categoryId(result.getCategoryId())
                .imageUrl(result.getImageUrl())
                .active(result.isActive())
                .createdAt(result.getCreatedAt())
                .updatedAt(result.getUpdatedAt())
                .build();
    }

    public List<ProductListResponse> toProductListResponses(List<ProductSummaryResult> results) {
        return results.stream()
                .map(result -> ProductListResponse.builder()
                        .id(result.getId())
                        .name(result.getName())
                        .price(result.getPrice())
                        .imageUrl(result.getImageUrl())
                        .active(result.isActive())
                        .build())
                .collect(Collectors.toList());
    }
}
