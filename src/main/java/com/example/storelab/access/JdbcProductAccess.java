package com.example.storelab.access;

import com.example.storelab.models.Product;
import com.example.storelab.models.ProductStats;
import com.example.storelab.models.ProductStatus;
import com.example.storelab.query.RecordQuery;
import com.example.storelab.query.SqlQueryTranslator;
import com.example.storelab.query.SqlQueryTranslator.SqlFragment;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JdbcProductAccess implements ProductAccess {

    static final String TABLE = "products";
    static final Map<String, String> COLUMNS = Map.of(
            "id", "id",
            "name", "name",
            "description", "description",
            "price", "price",
            "quantity", "quantity",
            "category", "category",
            "status", "status",
            "createdAt", "created_at",
            "updatedAt", "updated_at");

    private static final String COLUMN_LIST =
            "id, name, description, price, quantity, category, status, created_at, updated_at";
    private static final String SELECT_FROM = "SELECT " + COLUMN_LIST + " FROM " + TABLE;

    private static final String INSERT_SQL = "INSERT INTO " + TABLE + " (" + COLUMN_LIST + ") "
            + "VALUES (:id, :name, :description, :price, :quantity, :category, :status, :createdAt, :updatedAt)";

    private static final String UPDATE_SQL = "UPDATE " + TABLE + " SET "
            + "name = :name, description = :description, price = :price, quantity = :quantity, "
            + "category = :category, status = :status, updated_at = :updatedAt "
            + "WHERE id = :id RETURNING " + COLUMN_LIST;

    private static final String DELETE_SQL = "DELETE FROM " + TABLE + " WHERE id = :id RETURNING " + COLUMN_LIST;

    private static final String STATS_SQL = "SELECT category, COUNT(id) AS product_count, "
            + "AVG(price) AS avg_price, COALESCE(SUM(quantity), 0) AS total_quantity "
            + "FROM " + TABLE + " GROUP BY category ORDER BY category NULLS LAST";

    private static final RowMapper<Product> PRODUCT_ROW_MAPPER = JdbcProductAccess::mapRow;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlQueryTranslator translator;

    public JdbcProductAccess(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.translator = new SqlQueryTranslator(COLUMNS);
    }

    @Override
    public Product insert(Product product) {
        Product toInsert = withId(product);
        jdbcTemplate.update(INSERT_SQL, params(toInsert));
        return toInsert;
    }

    @Override
    @Transactional
    public List<Product> insertAll(List<Product> products) {
        List<Product> toInsert = products.stream().map(JdbcProductAccess::withId).toList();
        SqlParameterSource[] batch = toInsert.stream()
                .map(JdbcProductAccess::params)
                .toArray(SqlParameterSource[]::new);
        jdbcTemplate.batchUpdate(INSERT_SQL, batch);
        return toInsert;
    }

    @Override
    public Optional<Product> findById(String id) {
        return parseId(id).flatMap(uuid -> jdbcTemplate.query(
                        SELECT_FROM + " WHERE id = :id",
                        new MapSqlParameterSource("id", uuid),
                        PRODUCT_ROW_MAPPER)
                .stream()
                .findFirst());
    }

    @Override
    public Optional<Product> replace(Product product) {
        Optional<UUID> id = parseId(product.getId());
        if (id.isEmpty()) {
            return Optional.empty();
        }
        MapSqlParameterSource params = params(product).addValue("id", id.get());
        return jdbcTemplate.query(UPDATE_SQL, params, PRODUCT_ROW_MAPPER).stream().findFirst();
    }

    @Override
    public Optional<Product> deleteById(String id) {
        return parseId(id).flatMap(uuid -> jdbcTemplate.query(
                        DELETE_SQL,
                        new MapSqlParameterSource("id", uuid),
                        PRODUCT_ROW_MAPPER)
                .stream()
                .findFirst());
    }

    @Override
    public List<Product> find(RecordQuery query) {
        SqlFragment fragment = translator.translate(query);
        return jdbcTemplate.query(fragment.select(SELECT_FROM), fragment.params(), PRODUCT_ROW_MAPPER);
    }

    @Override
    public long count(RecordQuery query) {
        SqlFragment fragment = translator.translate(query.withoutWindow());
        Long count = jdbcTemplate.queryForObject(fragment.count(TABLE), fragment.params(), Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public List<ProductStats> statsByCategory() {
        return jdbcTemplate.query(STATS_SQL, (rs, rowNum) -> new ProductStats(
                rs.getString("category"),
                rs.getLong("product_count"),
                rs.getBigDecimal("avg_price"),
                rs.getLong("total_quantity")));
    }

    private static Product withId(Product product) {
        if (product.getId() != null) {
            return product;
        }
        return product.toBuilder().id(UUID.randomUUID().toString()).build();
    }

    private static Optional<UUID> parseId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(id));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    private static MapSqlParameterSource params(Product product) {
        return new MapSqlParameterSource()
                .addValue("id", product.getId() == null ? null : UUID.fromString(product.getId()))
                .addValue("name", product.getName())
                .addValue("description", product.getDescription())
                .addValue("price", product.getPrice())
                .addValue("quantity", product.getQuantity())
                .addValue("category", product.getCategory())
                .addValue("status", product.getStatus().value())
                .addValue("createdAt", toTimestamp(product.getCreatedAt()))
                .addValue("updatedAt", toTimestamp(product.getUpdatedAt()));
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Product mapRow(ResultSet rs, int rowNum) throws SQLException {
        String rawStatus = rs.getString("status");
        return Product.builder()
                .id(rs.getObject("id", UUID.class).toString())
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .price(rs.getBigDecimal("price"))
                .quantity(rs.getInt("quantity"))
                .category(rs.getString("category"))
                .status(ProductStatus.fromValue(rawStatus)
                        .orElseThrow(() -> new SQLException("Unknown product status " + rawStatus)))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .updatedAt(rs.getTimestamp("updated_at").toInstant())
                .build();
    }
}
