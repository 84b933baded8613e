package quest.gekko.searchvolume.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.searchvolume.domain.UserSubscription;

import java.util.Collection;
import java.util.List;

public interface UserSubscriptionRepository extends JpaRepository<UserSubscription, Long> {
    List<UserSubscription> findByUserIdAndKeywordIdIn(final Long userId, final Collection<Long> keywordIds);
}
