package quest.gekko.searchvolume.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "keywords")
@Getter @Setter
public class Keyword {
    @Id
    @Column(name = "keyword_id")
    Long id;

    @Column(name = "keyword_name", nullable = false)
    String name;
}
