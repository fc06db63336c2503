package fun.ai.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FunAiWorkspaceSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(FunAiWorkspaceSyncApplication.class, args);
    }
}
