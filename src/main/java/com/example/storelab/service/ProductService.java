package com.example.storelab.service;

import com.example.storelab.access.ProductAccess;
import com.example.storelab.config.QueryProperties;
import com.example.storelab.models.Product;
import com.example.storelab.models.ProductStats;
import com.example.storelab.models.ProductStatus;
import com.example.storelab.query.Criterion;
import com.example.storelab.query.FilterWhitelist;
import com.example.storelab.query.PageSpec;
import com.example.storelab.query.PagedResult;
import com.example.storelab.query.RecordQuery;
import com.example.storelab.query.SortOrder;
import com.example.storelab.requests.ListRecordsServiceRequest;
import com.example.storelab.requests.ProductHttpRequest;
import com.example.storelab.validation.FieldError;
import com.example.storelab.validation.RecordValidator;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Product operations over the PostgreSQL-backed {@link ProductAccess}. Mirrors
 * {@link UserService}; bulk creation is all-or-nothing because the access layer writes the batch
 * in one transaction.
 */
@Service
@Slf4j
public class ProductService {

    static final FilterWhitelist LIST_FILTERS = FilterWhitelist.of("category", "status");
    static final List<String> SEARCH_FIELDS = List.of("name", "description");

    private final ProductAccess productAccess;
    private final RecordValidator validator;
    private final QueryProperties queryProperties;
    private final Clock clock;

    public ProductService(ProductAccess productAccess,
                          RecordValidator validator,
                          QueryProperties queryProperties,
                          Clock clock) {
        this.productAccess = productAccess;
        this.validator = validator;
        this.queryProperties = queryProperties;
        this.clock = clock;
    }

    public Product createProduct(ProductHttpRequest request) {
        Objects.requireNonNull(request, "request");

        Product candidate = newProduct(request, now());
        List<FieldError> errors = validate(candidate, request.status());
        if (!errors.isEmpty()) {
            throw StoreLabException.validationFailed(errors);
        }

        try {
            return productAccess.insert(candidate);
        } catch (DuplicateKeyException ex) {
            throw StoreLabException.duplicateField("id", ex);
        }
    }

    public List<Product> bulkCreateProducts(List<ProductHttpRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw StoreLabException.validationFailed(
                    List.of(new FieldError("products", "At least one product is required")));
        }

        Instant now = now();
        List<Product> candidates = new ArrayList<>();
        List<FieldError> errors = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            ProductHttpRequest request = requests.get(i);
            if (request == null) {
                errors.add(new FieldError("[" + i + "]", "Product payload is required"));
                continue;
            }
            Product candidate = newProduct(request, now);
            for (FieldError error : validate(candidate, request.status())) {
                errors.add(error.atIndex(i));
            }
            candidates.add(candidate);
        }
        if (!errors.isEmpty()) {
            throw StoreLabException.validationFailed(errors);
        }

        try {
            return productAccess.insertAll(candidates);
        } catch (DuplicateKeyException ex) {
            throw StoreLabException.duplicateField("id", ex);
        }
    }

    public PagedResult<Product> listProducts(ListRecordsServiceRequest request) {
        Objects.requireNonNull(request, "request");

        PageSpec page = request.page().clampLimit(queryProperties.getMaxPageSize());
        RecordQuery query = RecordQuery.builder()
                .whereAll(LIST_FILTERS.apply(request.parameters()))
                .sort(SortOrder.desc("createdAt"), SortOrder.desc("id"))
                .page(page)
                .build();

        List<Product> products = productAccess.find(query);
        long total = productAccess.count(query);
        return PagedResult.of(products, total, page);
    }

    public Product getProduct(String id) {
        Objects.requireNonNull(id, "id");
        return productAccess.findById(id)
                .orElseThrow(() -> StoreLabException.productNotFound(id));
    }

    public Product updateProduct(String id, ProductHttpRequest request) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(request, "request");

        Product existing = productAccess.findById(id)
                .orElseThrow(() -> StoreLabException.productNotFound(id));

        Product.ProductBuilder builder = existing.toBuilder();
        if (request.name() != null) {
            builder.name(request.name().trim());
        }
        if (request.description() != null) {
            builder.description(request.description());
        }
        if (request.price() != null) {
            builder.price(request.price());
        }
        if (request.quantity() != null) {
            builder.quantity(request.quantity());
        }
        if (request.category() != null) {
            builder.category(request.category());
        }
        if (request.status() != null) {
            ProductStatus.fromValue(request.status()).ifPresent(builder::status);
        }
        Product merged = builder.updatedAt(now()).build();

        List<FieldError> errors = validate(merged, request.status());
        if (!errors.isEmpty()) {
            throw StoreLabException.validationFailed(errors);
        }

        return productAccess.replace(merged)
                .orElseThrow(() -> StoreLabException.productNotFound(id));
    }

    public Product deleteProduct(String id) {
        Objects.requireNonNull(id, "id");
        Product deleted = productAccess.deleteById(id)
                .orElseThrow(() -> StoreLabException.productNotFound(id));
        log.info("Deleted product {}", deleted.getId());
        return deleted;
    }

    public List<Product> searchProducts(String text) {
        if (text == null || text.isBlank()) {
            throw StoreLabException.searchQueryRequired();
        }

        RecordQuery query = RecordQuery.builder()
                .whereAny(SEARCH_FIELDS.stream()
                        .map(field -> Criterion.containsIgnoreCase(field, text))
                        .toList())
                .limit(queryProperties.getSearchLimit())
                .build();
        return productAccess.find(query);
    }

    /**
     * Products priced within [min, max], both ends inclusive and optional.
     */
    public List<Product> productsByPriceRange(BigDecimal min, BigDecimal max) {
        RecordQuery.Builder query = RecordQuery.builder()
                .where(Criterion.gte("price", min == null ? BigDecimal.ZERO : min))
                .sort(SortOrder.asc("price"));
        if (max != null) {
            query.where(Criterion.lte("price", max));
        }
        return productAccess.find(query.build());
    }

    /**
     * Available products whose quantity is at or below {@code threshold}; the configured
     * default applies when it is null.
     */
    public List<Product> lowStockProducts(Integer threshold) {
        int effective = threshold == null ? queryProperties.getLowStockThreshold() : threshold;
        if (effective < 0) {
            throw new IllegalArgumentException("threshold must be >= 0");
        }
        RecordQuery query = RecordQuery.builder()
                .where(Criterion.lte("quantity", effective))
                .where(Criterion.eq("status", ProductStatus.AVAILABLE))
                .sort(SortOrder.asc("quantity"))
                .build();
        return productAccess.find(query);
    }

    public List<ProductStats> productStats() {
        return productAccess.statsByCategory();
    }

    public long countProducts(Map<String, String> parameters) {
        RecordQuery query = RecordQuery.builder()
                .whereAll(LIST_FILTERS.apply(parameters))
                .build();
        return productAccess.count(query);
    }

    private Product newProduct(ProductHttpRequest request, Instant now) {
        return Product.builder()
                .name(request.name() == null ? null : request.name().trim())
                .description(request.description())
                .price(request.price())
                .quantity(request.quantity() == null ? 0 : request.quantity())
                .category(request.category())
                .status(ProductStatus.fromValue(request.status()).orElse(ProductStatus.DEFAULT))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private List<FieldError> validate(Product candidate, String rawStatus) {
        List<FieldError> errors = new ArrayList<>(validator.validate(candidate));
        if (rawStatus != null && ProductStatus.fromValue(rawStatus).isEmpty()) {
            errors.add(new FieldError("status", rawStatus + " is not a valid status"));
        }
        errors.sort(Comparator.comparing(FieldError::field).thenComparing(FieldError::message));
        return errors;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
