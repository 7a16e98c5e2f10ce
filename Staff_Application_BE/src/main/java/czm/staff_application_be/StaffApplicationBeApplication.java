package czm.staff_application_be;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StaffApplicationBeApplication {

    public static void main(String[] args) {
        SpringApplication.run(StaffApplicationBeApplication.class, args);
    }

}
