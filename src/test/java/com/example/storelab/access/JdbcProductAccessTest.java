package com.example.storelab.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.storelab.models.Product;
import com.example.storelab.models.ProductStats;
import com.example.storelab.models.ProductStatus;
import com.example.storelab.query.Criterion;
import com.example.storelab.query.PageSpec;
import com.example.storelab.query.RecordQuery;
import com.example.storelab.query.SortOrder;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(JdbcProductAccess.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
class JdbcProductAccessTest {

    private static final DockerImageName POSTGRES_IMAGE = DockerImageName.parse("postgres:16-alpine");
    private static final Instant T0 = Instant.parse("2024-10-02T08:00:00Z");

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>(POSTGRES_IMAGE);

    @DynamicPropertySource
    static void datasourceProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.sql.init.mode", () -> "always");
    }

    @Autowired
    private ProductAccess productAccess;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        jdbcTemplate.execute("TRUNCATE TABLE products");
    }

    @Test
    @DisplayName("insert generates a UUID and reads back every column")
    void insertAndRead() {
        Product stored = productAccess.insert(product("Widget", "9.99", 5, "Tools", ProductStatus.AVAILABLE, T0));

        UUID.fromString(stored.getId());
        Product read = productAccess.findById(stored.getId()).orElseThrow();
        assertEquals("Widget", read.getName());
        assertEquals(new BigDecimal("9.99"), read.getPrice());
        assertEquals(5, read.getQuantity());
        assertEquals(ProductStatus.AVAILABLE, read.getStatus());
        assertEquals(T0, read.getCreatedAt());
    }

    @Test
    @DisplayName("malformed and unknown ids are absent")
    void unknownIds() {
        assertEquals(Optional.empty(), productAccess.findById("42"));
        assertEquals(Optional.empty(), productAccess.deleteById(UUID.randomUUID().toString()));
    }

    @Test
    @DisplayName("replace keeps created_at and delete returns the row once")
    void replaceAndDelete() {
        Product stored = productAccess.insert(product("Widget", "9.99", 5, "Tools", ProductStatus.AVAILABLE, T0));

        Product replaced = productAccess.replace(stored.toBuilder()
                .quantity(0)
                .status(ProductStatus.OUT_OF_STOCK)
                .createdAt(T0.plusSeconds(999))
                .updatedAt(T0.plusSeconds(60))
                .build()).orElseThrow();

        assertEquals(0, replaced.getQuantity());
        assertEquals(ProductStatus.OUT_OF_STOCK, replaced.getStatus());
        assertEquals(T0, replaced.getCreatedAt());
        assertEquals(T0.plusSeconds(60), replaced.getUpdatedAt());

        assertTrue(productAccess.deleteById(stored.getId()).isPresent());
        assertTrue(productAccess.deleteById(stored.getId()).isEmpty());
    }

    @Test
    @DisplayName("filters, sort and window translate into SQL")
    void findAndCount() {
        for (int i = 0; i < 4; i++) {
            productAccess.insert(product("Tool " + i, "1.00", i, "Tools", ProductStatus.AVAILABLE, T0.plusSeconds(i)));
        }
        productAccess.insert(product("Lamp", "1.00", 1, "Home", ProductStatus.AVAILABLE, T0));

        RecordQuery query = RecordQuery.builder()
                .where(Criterion.eq("category", "Tools"))
                .where(Criterion.eq("status", ProductStatus.AVAILABLE))
                .sort(SortOrder.desc("createdAt"))
                .page(PageSpec.of(2, 3))
                .build();

        assertEquals(List.of("Tool 0"), productAccess.find(query).stream().map(Product::getName).toList());
        assertEquals(4, productAccess.count(query));
    }

    @Test
    @DisplayName("search treats LIKE wildcards literally")
    void containsSearch() {
        productAccess.insert(product("100% cotton", "1.00", 1, null, ProductStatus.AVAILABLE, T0));
        productAccess.insert(product("1000 cotton balls", "1.00", 1, null, ProductStatus.AVAILABLE, T0));

        RecordQuery query = RecordQuery.builder()
                .whereAny(List.of(
                        Criterion.containsIgnoreCase("name", "100%"),
                        Criterion.containsIgnoreCase("description", "100%")))
                .build();

        assertEquals(List.of("100% cotton"), productAccess.find(query).stream().map(Product::getName).toList());
    }

    @Test
    @DisplayName("stats aggregate per category")
    void statsByCategory() {
        productAccess.insert(product("A", "10.00", 5, "Tools", ProductStatus.AVAILABLE, T0));
        productAccess.insert(product("B", "20.00", 3, "Tools", ProductStatus.AVAILABLE, T0));
        productAccess.insert(product("C", "5.00", 1, null, ProductStatus.AVAILABLE, T0));

        List<ProductStats> stats = productAccess.statsByCategory();

        assertEquals(2, stats.size());
        ProductStats tools = stats.get(0);
        assertEquals("Tools", tools.category());
        assertEquals(2, tools.count());
        assertEquals(0, new BigDecimal("15").compareTo(tools.avgPrice()));
        assertEquals(8, tools.totalQuantity());
        assertNull(stats.get(1).category());
    }

    @Test
    @DisplayName("bulk insert rolls back entirely when one row fails")
    void insertAllIsAtomic() {
        Product existing = productAccess.insert(product("Existing", "1.00", 1, null, ProductStatus.AVAILABLE, T0));

        assertThrows(DataIntegrityViolationException.class, () -> productAccess.insertAll(List.of(
                product("New", "1.00", 1, null, ProductStatus.AVAILABLE, T0),
                product("Clash", "1.00", 1, null, ProductStatus.AVAILABLE, T0).toBuilder()
                        .id(existing.getId())
                        .build())));

        assertEquals(1, productAccess.count(RecordQuery.builder().build()));
    }

    @Test
    @DisplayName("check constraints back up validation")
    void checkConstraints() {
        assertThrows(DataIntegrityViolationException.class, () -> productAccess.insert(
                product("Bad", "-1.00", 1, null, ProductStatus.AVAILABLE, T0)));
    }

    private static Product product(String name, String price, int quantity, String category,
                                   ProductStatus status, Instant createdAt) {
        return Product.builder()
                .name(name)
                .price(new BigDecimal(price))
                .quantity(quantity)
                .category(category)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build();
    }
}
