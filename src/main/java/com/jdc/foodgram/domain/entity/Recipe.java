package com.jdc.foodgram.domain.entity;

import com.jdc.foodgram.domain.entity.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.BatchSize;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(
        name = "recipes",
        uniqueConstraints = {
                @UniqueConstraint(name = Recipe.UK_SHORT_LINK, columnNames = {"short_link"})
        },
        indexes = {
                @Index(name = "idx_recipes_author_id", columnList = "author_id"),
                @Index(name = "idx_recipes_created_at", columnList = "created_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Recipe extends BaseTimeEntity {

    public static final String UK_SHORT_LINK = "uk_recipes_short_link";

    public static final int MIN_COOKING_TIME = 1;
    public static final int MAX_COOKING_TIME = 32000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User author;

    @Column(nullable = false, length = 256)
    private String name;

    @Column(nullable = false)
    private String image;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String text;

    @Column(name = "cooking_time", nullable = false)
    private Integer cookingTime;

    @Column(name = "short_link", nullable = false, length = 16, updatable = false)
    private String shortLink;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "recipe_tags",
            joinColumns = @JoinColumn(name = "recipe_id"),
            inverseJoinColumns = @JoinColumn(name = "tag_id")
    )
    @OrderBy("name ASC")
    @BatchSize(size = 20)
    @Builder.Default
    private Set<Tag> tags = new LinkedHashSet<>();

    @OneToMany(mappedBy = "recipe", fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    @BatchSize(size = 20)
    @Builder.Default
    private List<RecipeIngredient> ingredients = new ArrayList<>();

    public void update(String name, String text, Integer cookingTime) {
        this.name = name;
        this.text = text;
        this.cookingTime = cookingTime;
    }

    public void updateImage(String image) {
        this.image = image;
    }

    public void replaceTags(Collection<Tag> newTags) {
        this.tags.clear();
        this.tags.addAll(newTags);
    }

    /**
     * 최초 저장 시에만 한 번 부여한다.
     */
    public void assignShortLinkIfAbsent(String shortLink) {
        if (this.shortLink == null || this.shortLink.isBlank()) {
            this.shortLink = shortLink;
        }
    }
}
