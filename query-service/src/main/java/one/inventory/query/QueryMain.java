package one.inventory.query;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class QueryMain {
    public static void main(String[] args) {
        SpringApplication.run(QueryMain.class, args);
    }
}
