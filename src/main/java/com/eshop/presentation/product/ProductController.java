package com.eshop.presentation.product;

import com.eshop.application.product.ProductService;
import com.eshop.common.exception.ValidationException;
import com.eshop.domain.product.ProductConstants;
import com.eshop.presentation.product.mapper.ProductMapper;
import com.eshop.presentation.product.request.ProductCreateRequest;
import com.eshop.presentation.product.request.ProductUpdateRequest;
import com.eshop.presentation.product.response.ProductListResponse;
import com.eshop.presentation.product.response.ProductResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * ProductController - 상품 API
 * 조회는 인증 없이, 등록/수정/삭제는 관리자만 가능
 */
@RestController
@RequestMapping("/products")
public class ProductController {

    private final ProductService productService;
    private final ProductMapper productMapper;

    public ProductController(ProductService productService, ProductMapper productMapper) {
        this.productService = productService;
        this.productMapper = productMapper;
    }

    /**
     * GET /products - 상품 목록 (category_id, active_only, skip, limit)
     */
    @GetMapping
    public ResponseEntity<List<ProductListResponse>> getProducts(
            @RequestParam(value = "category_id", required = false) Long categoryId,
            @RequestParam(value = "active_only", defaultValue = "true") boolean activeOnly,
            @RequestParam(value = "skip", defaultValue = "0") int skip,
            @RequestParam(value = "limit", defaultValue = "" + ProductConstants.DEFAULT_LIST_LIMIT) int limit) {
        var results = productService.getProducts(categoryId, activeOnly, skip, limit);
        return ResponseEntity.ok(productMapper.toProductListResponses(results));
    }

    @GetMapping("/{product_id}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable("product_id") Long productId) {
        return ResponseEntity.ok(productMapper.toProductResponse(productService.getProduct(productId)));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ProductResponse> createProduct(
            @RequestBody(required = false) ProductCreateRequest request) {
        if (request == null) {
            throw new ValidationException("요청 본문은 필수입니다");
        }
        var result = productService.createProduct(productMapper.toCreateProductCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(productMapper.toProductResponse(result));
    }

    /**
     * PATCH/PUT /products/{product_id} - 부분 수정 (보낸 필드만 변경)
     */
    @RequestMapping(value = "/{product_id}", method = {RequestMethod.PATCH, RequestMethod.PUT})
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ProductResponse> updateProduct(
            @PathVariable("product_id") Long productId,
            @RequestBody ProductUpdateRequest request) {
        var result = productService.updateProduct(productId, productMapper.toUpdateProductCommand(request));
        return ResponseEntity.ok(productMapper.toProductResponse(result));
    }

    /**
     * DELETE /products/{product_id} - 소프트 삭제 (is_active=false)
     */
    @DeleteMapping("/{product_id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteProduct(@PathVariable("product_id") Long productId) {
        productService.deleteProduct(productId);
        return ResponseEntity.noContent().build();
    }
}
