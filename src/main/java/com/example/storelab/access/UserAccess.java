package com.example.storelab.access;

import com.example.storelab.models.User;
import com.example.storelab.models.UserStats;
import com.example.storelab.query.RecordQuery;
import java.util.List;
import java.util.Optional;

public interface UserAccess {

    /**
     * Inserts a new user; the store assigns the id. Fails with a duplicate-key error when the
     * email is already taken.
     */
    User insert(User user);

    /**
     * Inserts the users in order without a transaction. A failure part-way through leaves the
     * users before it in place.
     */
    List<User> insertAll(List<User> users);

    /**
     * Returns empty for ids that are not valid ObjectIds as well as for unknown ones.
     */
    Optional<User> findById(String id);

    Optional<User> findByEmail(String email);

    /**
     * Replaces the stored user with the same id. Empty if it no longer exists.
     */
    Optional<User> replace(User user);

    Optional<User> deleteById(String id);

    List<User> find(RecordQuery query);

    /**
     * Counts matches of the query's predicates, ignoring its sort and window.
     */
    long count(RecordQuery query);

    /**
     * One entry per status that has at least one user.
     */
    List<UserStats> statsByStatus();
}
