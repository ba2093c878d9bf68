package com.example.storelab.http;

import com.example.storelab.models.Product;
import com.example.storelab.query.PagedResult;
import com.example.storelab.requests.ListRecordsServiceRequest;
import com.example.storelab.requests.ProductHttpRequest;
import com.example.storelab.service.ProductService;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for PostgreSQL-backed products.
 */
@RestController
@RequestMapping("/api/postgres")
public class ProductController {

    private final ProductService productService;
    private final Clock clock;

    public ProductController(ProductService productService, Clock clock) {
        this.productService = productService;
        this.clock = clock;
    }

    @GetMapping("/test")
    public ResponseEntity<ApiResponse<Map<String, String>>> testConnection() {
        return ResponseEntity.ok(ApiResponse.ok(
                Map.of("timestamp", clock.instant().toString()),
                "PostgreSQL connection is working"));
    }

    @PostMapping("/products")
    public ResponseEntity<ApiResponse<ProductResponse>> createProduct(@RequestBody ProductHttpRequest request) {
        Product product = productService.createProduct(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(ProductResponse.from(product)));
    }

    @PostMapping("/products/bulk")
    public ResponseEntity<ApiResponse<List<ProductResponse>>> bulkCreateProducts(
            @RequestBody List<ProductHttpRequest> requests) {
        List<ProductResponse> created = productService.bulkCreateProducts(requests).stream()
                .map(ProductResponse::from)
                .toList();
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(created));
    }

    @GetMapping("/products")
    public ResponseEntity<ApiResponse<List<ProductResponse>>> getAllProducts(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam Map<String, String> parameters
    ) {
        PagedResult<ProductResponse> result = productService
                .listProducts(ListRecordsServiceRequest.of(page, limit, parameters))
                .map(ProductResponse::from);
        return ResponseEntity.ok(ApiResponse.page(result.items(), PaginationResponse.from(result)));
    }

    @GetMapping("/products/search")
    public ResponseEntity<ApiResponse<List<ProductResponse>>> searchProducts(
            @RequestParam(value = "q", required = false) String query) {
        return ResponseEntity.ok(ApiResponse.ok(toResponses(productService.searchProducts(query))));
    }

    @GetMapping("/products/price-range")
    public ResponseEntity<ApiResponse<List<ProductResponse>>> getProductsByPriceRange(
            @RequestParam(value = "min", required = false) BigDecimal min,
            @RequestParam(value = "max", required = false) BigDecimal max
    ) {
        return ResponseEntity.ok(ApiResponse.ok(toResponses(productService.productsByPriceRange(min, max))));
    }

    @GetMapping("/products/low-stock")
    public ResponseEntity<ApiResponse<List<ProductResponse>>> getLowStockProducts(
            @RequestParam(value = "threshold", required = false) Integer threshold) {
        return ResponseEntity.ok(ApiResponse.ok(toResponses(productService.lowStockProducts(threshold))));
    }

    @GetMapping("/products/stats")
    public ResponseEntity<ApiResponse<List<ProductStatsResponse>>> getProductStats() {
        List<ProductStatsResponse> stats = productService.productStats().stream()
                .map(ProductStatsResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(stats));
    }

    @GetMapping("/products/count")
    public ResponseEntity<ApiResponse<Map<String, Long>>> countProducts(
            @RequestParam Map<String, String> parameters) {
        return ResponseEntity.ok(ApiResponse.ok(Map.of("count", productService.countProducts(parameters))));
    }

    @GetMapping("/products/{id}")
    public ResponseEntity<ApiResponse<ProductResponse>> getProductById(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.ok(ProductResponse.from(productService.getProduct(id))));
    }

    @RequestMapping(path = "/products/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public ResponseEntity<ApiResponse<ProductResponse>> updateProduct(
            @PathVariable String id,
            @RequestBody ProductHttpRequest request
    ) {
        return ResponseEntity.ok(ApiResponse.ok(ProductResponse.from(productService.updateProduct(id, request))));
    }

    @DeleteMapping("/products/{id}")
    public ResponseEntity<ApiResponse<ProductResponse>> deleteProduct(@PathVariable String id) {
        Product deleted = productService.deleteProduct(id);
        return ResponseEntity.ok(ApiResponse.ok(ProductResponse.from(deleted), "Product deleted successfully"));
    }

    private List<ProductResponse> toResponses(List<Product> products) {
        return products.stream().map(ProductResponse::from).toList();
    }
}
