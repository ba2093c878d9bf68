package com.example.storelab.http;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.storelab.config.ClockConfig;
import com.example.storelab.models.Product;
import com.example.storelab.models.ProductStats;
import com.example.storelab.models.ProductStatus;
import com.example.storelab.query.PageSpec;
import com.example.storelab.query.PagedResult;
import com.example.storelab.service.ProductService;
import com.example.storelab.service.StoreLabException;
import com.example.storelab.validation.FieldError;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@WebMvcTest(controllers = ProductController.class)
@Import(ClockConfig.class)
class ProductControllerTest {

    private static final String PRODUCT_ID = "7d8a7e0c-2f0c-4c6f-9f4b-1b6a5c3d2e10";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProductService productService;

    @Test
    @DisplayName("POST product returns 201 with the stored row")
    void createProduct() throws Exception {
        when(productService.createProduct(any())).thenReturn(widget());

        mockMvc.perform(MockMvcRequestBuilders.post("/api/postgres/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Widget\",\"price\":9.99,\"quantity\":5,\"category\":\"Tools\"}"))
                .andExpect(MockMvcResultMatchers.status().isCreated())
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.id", equalTo(PRODUCT_ID)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.price", equalTo(9.99)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.status", equalTo("available")));
    }

    @Test
    @DisplayName("bulk validation failure lists errors by index")
    void bulkCreateValidation() throws Exception {
        when(productService.bulkCreateProducts(any())).thenThrow(StoreLabException.validationFailed(
                List.of(new FieldError("[1].price", "Price is required"))));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/postgres/products/bulk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"name\":\"A\",\"price\":1},{\"name\":\"B\"}]"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.errors[0].field", equalTo("[1].price")));
    }

    @Test
    @DisplayName("GET products forwards filters and reports pagination")
    void listProducts() throws Exception {
        when(productService.listProducts(any())).thenReturn(
                PagedResult.of(List.of(widget()), 1, PageSpec.of(1, 10)));

        mockMvc.perform(MockMvcRequestBuilders.get("/api/postgres/products").param("category", "Tools"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.data[0].name", equalTo("Widget")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.pagination.pages", equalTo(1)));
    }

    @Test
    @DisplayName("price range passes optional bounds through")
    void priceRange() throws Exception {
        when(productService.productsByPriceRange(any(), any())).thenReturn(List.of(widget()));

        mockMvc.perform(MockMvcRequestBuilders.get("/api/postgres/products/price-range").param("min", "5"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.data", hasSize(1)));

        verify(productService).productsByPriceRange(eq(new BigDecimal("5")), isNull());
    }

    @Test
    @DisplayName("negative low-stock threshold is a client error")
    void lowStockNegative() throws Exception {
        when(productService.lowStockProducts(-1)).thenThrow(new IllegalArgumentException("threshold must be >= 0"));

        mockMvc.perform(MockMvcRequestBuilders.get("/api/postgres/products/low-stock").param("threshold", "-1"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.message", equalTo("threshold must be >= 0")));
    }

    @Test
    @DisplayName("GET products/count is not routed to the id lookup")
    void countProducts() throws Exception {
        when(productService.countProducts(Map.of("category", "tools"))).thenReturn(7L);

        mockMvc.perform(MockMvcRequestBuilders.get("/api/postgres/products/count").param("category", "tools"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.count", equalTo(7)));
    }

    @Test
    @DisplayName("stats render category aggregates")
    void stats() throws Exception {
        when(productService.productStats()).thenReturn(List.of(
                new ProductStats("Tools", 2, new BigDecimal("14.745"), 8)));

        mockMvc.perform(MockMvcRequestBuilders.get("/api/postgres/products/stats"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.data[0].category", equalTo("Tools")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data[0].count", equalTo(2)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data[0].totalQuantity", equalTo(8)));
    }

    @Test
    @DisplayName("GET, PATCH and DELETE on a missing product are 404")
    void missingProduct() throws Exception {
        when(productService.getProduct(PRODUCT_ID)).thenThrow(StoreLabException.productNotFound(PRODUCT_ID));
        when(productService.updateProduct(eq(PRODUCT_ID), any())).thenThrow(StoreLabException.productNotFound(PRODUCT_ID));
        when(productService.deleteProduct(PRODUCT_ID)).thenThrow(StoreLabException.productNotFound(PRODUCT_ID));

        mockMvc.perform(MockMvcRequestBuilders.get("/api/postgres/products/" + PRODUCT_ID))
                .andExpect(MockMvcResultMatchers.status().isNotFound());
        mockMvc.perform(MockMvcRequestBuilders.patch("/api/postgres/products/" + PRODUCT_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\":0}"))
                .andExpect(MockMvcResultMatchers.status().isNotFound());
        mockMvc.perform(MockMvcRequestBuilders.delete("/api/postgres/products/" + PRODUCT_ID))
                .andExpect(MockMvcResultMatchers.status().isNotFound())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("PRODUCT_NOT_FOUND")));
    }

    @Test
    @DisplayName("DELETE returns the removed product and a confirmation message")
    void deleteProduct() throws Exception {
        when(productService.deleteProduct(PRODUCT_ID)).thenReturn(widget());

        mockMvc.perform(MockMvcRequestBuilders.delete("/api/postgres/products/" + PRODUCT_ID))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.message", equalTo("Product deleted successfully")));
    }

    @Test
    @DisplayName("unexpected failures return a generic 500")
    void unexpectedFailure() throws Exception {
        when(productService.searchProducts("boom")).thenThrow(new IllegalStateException("kaput"));

        mockMvc.perform(MockMvcRequestBuilders.get("/api/postgres/products/search").param("q", "boom"))
                .andExpect(MockMvcResultMatchers.status().isInternalServerError())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("INTERNAL_ERROR")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.message", equalTo("Internal Server Error")));
    }

    private static Product widget() {
        Instant now = Instant.parse("2024-10-01T00:00:00Z");
        return Product.builder()
                .id(PRODUCT_ID)
                .name("Widget")
                .price(new BigDecimal("9.99"))
                .quantity(5)
                .category("Tools")
                .status(ProductStatus.AVAILABLE)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
