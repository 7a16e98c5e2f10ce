package czm.staff_application_be.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ApplicationConfig {
    private static final Logger log = LoggerFactory.getLogger(ApplicationConfig.class);

    @Bean
    public ApplicationSettings applicationSettings(StaffApplicationProperties props) {
        ApplicationSettings settings = ApplicationSettings.from(props);
        log.info("Loaded staff application settings questions={} cooldown={} scales={} staffChannel={}",
                settings.questionCount(), settings.cooldown(), settings.scoreScales(), settings.staffChannelId());
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
