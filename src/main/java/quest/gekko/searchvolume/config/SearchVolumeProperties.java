package quest.gekko.searchvolume.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Configuration properties for querying, snapshot derivation, caching and the admin account
 */
@Configuration
@EnableConfigurationProperties({
        SearchVolumeProperties.Query.class,
        SearchVolumeProperties.Snapshot.class,
        SearchVolumeProperties.Cache.class,
        SearchVolumeProperties.Admin.class
})
public class SearchVolumeProperties {

    /**
     * @param zone zone that unix timestamps of a request are converted to calendar dates in
     */
    @ConfigurationProperties("search-volume.query")
    public record Query(@DefaultValue("UTC") String zone) {
        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }

    /**
     * @param anchorTime   wall-clock time a daily snapshot is anchored to, ISO format
     * @param cron         schedule of the recurring derivation
     * @param zone         zone the schedule and "today" are evaluated in
     * @param lookbackDays days before today re-derived on each run
     */
    @ConfigurationProperties("search-volume.snapshot")
    public record Snapshot(@DefaultValue("09:00") String anchorTime,
                           @DefaultValue("0 15 * * * *") String cron,
                           @DefaultValue("UTC") String zone,
                           @DefaultValue("1") int lookbackDays) {
        public LocalTime anchor() {
            return LocalTime.parse(anchorTime);
        }

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }

    /**
     * @param keywordNamesMaxSize most keyword names held at once
     * @param keywordNamesTtl     time a cached keyword name stays valid after loading
     */
    @ConfigurationProperties("search-volume.cache")
    public record Cache(@DefaultValue("10000") long keywordNamesMaxSize,
                        @DefaultValue("30m") Duration keywordNamesTtl) {}

    @ConfigurationProperties("security.admin")
    public record Admin(String username, String password) {}
}
