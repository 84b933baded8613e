package quest.gekko.searchvolume.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.searchvolume.domain.Keyword;

public interface KeywordRepository extends JpaRepository<Keyword, Long> {
}
