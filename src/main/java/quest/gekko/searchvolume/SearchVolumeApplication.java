package quest.gekko.searchvolume;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SearchVolumeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SearchVolumeApplication.class, args);
    }

}
