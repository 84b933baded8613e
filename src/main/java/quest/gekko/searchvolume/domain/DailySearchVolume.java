package quest.gekko.searchvolume.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "keyword_search_volume_daily", uniqueConstraints = @UniqueConstraint(columnNames = { "keyword_id", "created_date" }))
@Getter @Setter
public class DailySearchVolume {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "keyword_id", nullable = false)
    Long keywordId;

    @Column(name = "created_date", nullable = false)
    LocalDate createdDate;

    // timestamp of the hourly sample picked for this date
    @Column(name = "anchor_datetime", nullable = false)
    LocalDateTime anchorDatetime;

    @Column(name = "search_volume", nullable = false)
    Long searchVolume;
}
