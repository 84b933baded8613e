package quest.gekko.searchvolume.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.searchvolume.domain.DailySearchVolume;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DailySearchVolumeRepository extends JpaRepository<DailySearchVolume, Long> {
    Optional<DailySearchVolume> findByKeywordIdAndCreatedDate(final Long keywordId, final LocalDate createdDate);

    List<DailySearchVolume> findByKeywordIdAndCreatedDateBetweenOrderByCreatedDateAsc(final Long keywordId, final LocalDate from, final LocalDate to);

    long countByKeywordId(final Long keywordId);
}
