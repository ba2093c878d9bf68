package com.example.storelab.access;

import static org.springframework.data.mongodb.core.aggregation.Aggregation.group;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.newAggregation;
import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

import com.example.storelab.models.User;
import com.example.storelab.models.UserStats;
import com.example.storelab.models.UserStatus;
import com.example.storelab.query.MongoQueryTranslator;
import com.example.storelab.query.RecordQuery;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.TypedAggregation;
import org.springframework.stereotype.Component;

@Component
public class MongoUserAccess implements UserAccess {

    static final Set<String> QUERYABLE_FIELDS = Set.of(
            "id", "name", "email", "age", "status", "createdAt", "updatedAt");

    private final MongoTemplate mongoTemplate;
    private final MongoQueryTranslator translator;

    public MongoUserAccess(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
        this.translator = new MongoQueryTranslator(QUERYABLE_FIELDS);
    }

    @Override
    public User insert(User user) {
        return mongoTemplate.insert(user);
    }

    @Override
    public List<User> insertAll(List<User> users) {
        // insertAll issues one ordered insertMany; it stops at the first failing document
        return new ArrayList<>(mongoTemplate.insertAll(users));
    }

    @Override
    public Optional<User> findById(String id) {
        if (!ObjectId.isValid(id)) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findById(id, User.class));
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return Optional.ofNullable(mongoTemplate.findOne(query(where("email").is(email)), User.class));
    }

    @Override
    public Optional<User> replace(User user) {
        if (!ObjectId.isValid(user.getId())) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findAndReplace(
                query(where("id").is(user.getId())),
                user,
                FindAndReplaceOptions.options().returnNew()));
    }

    @Override
    public Optional<User> deleteById(String id) {
        if (!ObjectId.isValid(id)) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findAndRemove(query(where("id").is(id)), User.class));
    }

    @Override
    public List<User> find(RecordQuery query) {
        return mongoTemplate.find(translator.translate(query), User.class);
    }

    @Override
    public long count(RecordQuery query) {
        return mongoTemplate.count(translator.translate(query.withoutWindow()), User.class);
    }

    @Override
    public List<UserStats> statsByStatus() {
        TypedAggregation<User> aggregation = newAggregation(User.class,
                group("status").count().as("count").avg("age").as("avgAge"));

        // $avg skips documents without an age and yields null when the whole group has none
        return mongoTemplate.aggregate(aggregation, Document.class).getMappedResults().stream()
                .map(MongoUserAccess::toStats)
                .sorted(Comparator.comparing(UserStats::status,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    private static UserStats toStats(Document document) {
        Object groupKey = document.get("_id");
        UserStatus status = groupKey == null ? null : UserStatus.fromValue(groupKey.toString()).orElse(null);
        Number count = document.get("count", Number.class);
        Number avgAge = document.get("avgAge", Number.class);
        return new UserStats(
                status,
                count == null ? 0L : count.longValue(),
                avgAge == null ? null : avgAge.doubleValue());
    }
}
