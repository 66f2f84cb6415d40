package com.jdc.foodgram.domain.entity.user;

import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.entity.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * 구독 관계 (subscriber → author).
 * 자기 자신 구독은 DB 체크 제약으로도 막는다.
 */
@Entity
@Table(name = "subscriptions", uniqueConstraints = {
        @UniqueConstraint(name = Subscription.UK_USER_AUTHOR, columnNames = {"user_id", "author_id"})
})
@Check(name = "ck_subscriptions_no_self", constraints = "user_id <> author_id")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Subscription extends BaseTimeEntity {

    public static final String UK_USER_AUTHOR = "uk_subscriptions_user_author";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User author;
}
