package one.inventory.store;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InventoryMain {
    public static void main(String[] args) {
        SpringApplication.run(InventoryMain.class, args);
    }
}
