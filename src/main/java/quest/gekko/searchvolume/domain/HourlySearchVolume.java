package quest.gekko.searchvolume.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "keyword_search_volume",
        uniqueConstraints = @UniqueConstraint(columnNames = { "keyword_id", "created_datetime" }),
        indexes = @Index(name = "idx_ksv_keyword_time", columnList = "keyword_id, created_datetime"))
@Getter @Setter
public class HourlySearchVolume {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "keyword_id", nullable = false)
    Long keywordId;

    @Column(name = "created_datetime", nullable = false)
    LocalDateTime createdDatetime;

    @Column(name = "search_volume", nullable = false)
    Long searchVolume;
}
