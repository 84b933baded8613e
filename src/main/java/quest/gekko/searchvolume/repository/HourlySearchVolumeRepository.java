package quest.gekko.searchvolume.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.searchvolume.domain.HourlySearchVolume;

import java.time.LocalDateTime;
import java.util.List;

public interface HourlySearchVolumeRepository extends JpaRepository<HourlySearchVolume, Long> {

    @Query("""
        select h from HourlySearchVolume h
        where h.keywordId = :keywordId
          and h.createdDatetime >= :from
          and h.createdDatetime < :to
        order by h.createdDatetime
        """)
    List<HourlySearchVolume> findRange(@Param("keywordId") final Long keywordId,
                                       @Param("from") final LocalDateTime from,
                                       @Param("to") final LocalDateTime toExclusive);

    @Query("""
        select distinct h.keywordId from HourlySearchVolume h
        where h.createdDatetime >= :from and h.createdDatetime < :to
        order by h.keywordId
        """)
    List<Long> findKeywordIdsBetween(@Param("from") final LocalDateTime from, @Param("to") final LocalDateTime toExclusive);
}
