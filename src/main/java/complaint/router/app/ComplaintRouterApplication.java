package complaint.router.app;

import complaint.router.app.config.ComplaintRouterProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.PropertySource;


@EnableConfigurationProperties(ComplaintRouterProperties.class)
@PropertySource(value = "file:./secrets.properties", ignoreResourceNotFound = true)
@SpringBootApplication()
public class ComplaintRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComplaintRouterApplication.class, args);
    }

}
