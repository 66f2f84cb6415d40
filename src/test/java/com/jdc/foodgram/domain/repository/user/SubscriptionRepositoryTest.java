package com.jdc.foodgram.domain.repository.user;

import com.jdc.foodgram.config.JpaConfig;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.entity.user.Subscription;
import com.jdc.foodgram.domain.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@Import(JpaConfig.class)
class SubscriptionRepositoryTest {

    @Autowired
    private SubscriptionRepository subscriptionRepository;
    @Autowired
    private UserRepository userRepository;

    private User reader;
    private User zed;
    private User amy;

    @BeforeEach
    void setUp() {
        reader = userRepository.save(user("reader"));
        zed = userRepository.save(user("zed"));
        amy = userRepository.save(user("amy"));
    }

    private static User user(String name) {
        return User.builder()
                .email(name + "@foodgram.io").username(name).firstName(name).lastName(name).password("pw")
                .build();
    }

    @Test
    @DisplayName("findAuthorsBySubscriberId: 구독한 작성자를 이메일 순으로 페이지 조회")
    void findAuthors_orderedByEmail() {
        subscriptionRepository.save(Subscription.builder().user(reader).author(zed).build());
        subscriptionRepository.save(Subscription.builder().user(reader).author(amy).build());
        subscriptionRepository.save(Subscription.builder().user(zed).author(amy).build());

        Page<User> page = subscriptionRepository.findAuthorsBySubscriberId(reader.getId(), PageRequest.of(0, 10));

        assertThat(page.getTotalElements()).isEqualTo(2);
        assertThat(page.getContent()).extracting(User::getUsername).containsExactly("amy", "zed");
        assertThat(subscriptionRepository.findAuthorIdsByUserIdAndAuthorIdIn(reader.getId(), List.of(amy.getId(), reader.getId())))
                .containsExactly(amy.getId());
    }

    @Test
    @DisplayName("같은 작성자를 두 번 구독할 수 없다")
    void subscription_unique() {
        subscriptionRepository.saveAndFlush(Subscription.builder().user(reader).author(zed).build());

        assertThatThrownBy(() -> subscriptionRepository.saveAndFlush(
                Subscription.builder().user(reader).author(zed).build()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("자기 자신을 구독하는 행은 DB 제약으로도 막힌다")
    void subscription_noSelf() {
        assertThatThrownBy(() -> subscriptionRepository.saveAndFlush(
                Subscription.builder().user(reader).author(reader).build()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("deleteByUserIdAndAuthorId: 삭제된 행 수를 돌려준다")
    void delete_returnsCount() {
        subscriptionRepository.save(Subscription.builder().user(reader).author(zed).build());

        assertThat(subscriptionRepository.existsByUserIdAndAuthorId(reader.getId(), zed.getId())).isTrue();
        assertThat(subscriptionRepository.deleteByUserIdAndAuthorId(reader.getId(), zed.getId())).isEqualTo(1);
        assertThat(subscriptionRepository.deleteByUserIdAndAuthorId(reader.getId(), zed.getId())).isZero();
    }
}
