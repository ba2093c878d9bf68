package com.example.storelab.models;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Row of the {@code products} table. Column names are the snake_case forms of the fields.
 */
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class Product {

    private String id;

    @NotBlank(message = "Name cannot be empty")
    @Size(max = 255, message = "Name must be between 1 and 255 characters")
    private String name;

    private String description;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0", message = "Price cannot be negative")
    @Digits(integer = 8, fraction = 2, message = "Price must be a valid decimal number")
    private BigDecimal price;

    @NotNull(message = "Quantity is required")
    @Min(value = 0, message = "Quantity cannot be negative")
    @Default
    private Integer quantity = 0;

    @Size(max = 100, message = "Category cannot exceed 100 characters")
    private String category;

    @NotNull(message = "Status is required")
    @Default
    private ProductStatus status = ProductStatus.DEFAULT;

    private Instant createdAt;

    private Instant updatedAt;
}
