package com.jdc.foodgram.domain.repository.user;

import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.entity.user.Subscription;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Set;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    boolean existsByUserIdAndAuthorId(Long userId, Long authorId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Subscription s WHERE s.user.id = :userId AND s.author.id = :authorId")
    int deleteByUserIdAndAuthorId(@Param("userId") Long userId, @Param("authorId") Long authorId);

    @Query(value = """
                SELECT a FROM Subscription s
                JOIN s.author a
                WHERE s.user.id = :userId
                ORDER BY a.email ASC
            """,
            countQuery = "SELECT COUNT(s) FROM Subscription s WHERE s.user.id = :userId")
    Page<User> findAuthorsBySubscriberId(@Param("userId") Long userId, Pageable pageable);

    @Query("SELECT s.author.id FROM Subscription s WHERE s.user.id = :userId AND s.author.id IN :authorIds")
    Set<Long> findAuthorIdsByUserIdAndAuthorIdIn(@Param("userId") Long userId,
                                                 @Param("authorIds") Collection<Long> authorIds);
}
