package com.example.storelab.access;

import com.example.storelab.models.Product;
import com.example.storelab.models.ProductStats;
import com.example.storelab.query.RecordQuery;
import java.util.List;
import java.util.Optional;

public interface ProductAccess {

    /**
     * Inserts a new product, generating its UUID when none is set.
     */
    Product insert(Product product);

    /**
     * Inserts all products in one transaction: either every row is written or none is.
     */
    List<Product> insertAll(List<Product> products);

    /**
     * Returns empty for ids that are not UUIDs as well as for unknown ones.
     */
    Optional<Product> findById(String id);

    /**
     * Overwrites the mutable columns of the product with the same id. Empty if it no longer exists.
     */
    Optional<Product> replace(Product product);

    Optional<Product> deleteById(String id);

    List<Product> find(RecordQuery query);

    long count(RecordQuery query);

    /**
     * One entry per category that has at least one product, ordered by category.
     */
    List<ProductStats> statsByCategory();
}
