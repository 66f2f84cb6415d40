package com.jdc.foodgram.domain.repository;

import com.jdc.foodgram.domain.entity.Recipe;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public interface RecipeRepository extends JpaRepository<Recipe, Long>, RecipeQueryRepository {

    boolean existsByShortLink(String shortLink);

    Optional<Recipe> findByShortLink(String shortLink);

    @Query("SELECT r.author.id FROM Recipe r WHERE r.id = :id")
    Optional<Long> findAuthorIdById(@Param("id") Long id);

    @EntityGraph(attributePaths = {"author", "tags"})
    @Query("SELECT r FROM Recipe r WHERE r.id = :id")
    Optional<Recipe> findDetailById(@Param("id") Long id);

    @Query("SELECT r FROM Recipe r WHERE r.author.id = :authorId ORDER BY r.createdAt DESC, r.id DESC")
    List<Recipe> findByAuthorIdOrderByNewest(@Param("authorId") Long authorId, Pageable pageable);

    @Query("SELECT r FROM Recipe r WHERE r.author.id = :authorId ORDER BY r.createdAt DESC, r.id DESC")
    List<Recipe> findAllByAuthorIdOrderByNewest(@Param("authorId") Long authorId);

    @Query("SELECT r.author.id, COUNT(r) FROM Recipe r WHERE r.author.id IN :authorIds GROUP BY r.author.id")
    List<Object[]> countByAuthorIdIn(@Param("authorIds") Collection<Long> authorIds);

    default Map<Long, Long> findRecipeCountsMapByAuthorIds(Collection<Long> authorIds) {
        if (authorIds == null || authorIds.isEmpty()) {
            return Map.of();
        }
        return countByAuthorIdIn(authorIds).stream()
                .collect(Collectors.toMap(
                        row -> (Long) row[0],
                        row -> (Long) row[1]
                ));
    }
}
