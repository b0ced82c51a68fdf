package com.github.dimitryivaniuta.scoped.gateway.model;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

/**
 * Reactive repository for {@link ScopedGroupEntity}.
 */
@Repository
public interface ScopedGroupRepository extends ReactiveCrudRepository<ScopedGroupEntity, Long> {

    /**
     * Union of the scopes of every group the user belongs to, in one round trip.
     *
     * @param userId user id as carried in the token subject
     * @return distinct scopes; empty when the user has no groups or none of them grant anything
     */
    @Query("""
      SELECT DISTINCT jsonb_array_elements_text(sg.scopes) AS scope
        FROM scoped_groups sg
        JOIN user_groups ug ON ug.group_id = sg.id
       WHERE ug.user_id = :userId
      """)
    Flux<String> findScopesForUser(@Param("userId") String userId);
}
