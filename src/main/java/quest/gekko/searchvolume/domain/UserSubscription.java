package quest.gekko.searchvolume.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

@Entity
@Table(name = "users_subscription", indexes = @Index(name = "idx_sub_user_keyword", columnList = "user_id, keyword_id"))
@Getter @Setter
public class UserSubscription {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "subscription_id")
    Long id;

    @Column(name = "user_id", nullable = false)
    Long userId;

    @Column(name = "keyword_id", nullable = false)
    Long keywordId;

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_type", nullable = false)
    Capability subscriptionType;

    // both bounds inclusive
    @Column(name = "start_time", nullable = false)
    LocalDate startTime;

    @Column(name = "end_time", nullable = false)
    LocalDate endTime;
}
