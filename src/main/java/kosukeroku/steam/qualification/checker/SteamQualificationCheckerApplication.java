package kosukeroku.steam.qualification.checker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SteamQualificationCheckerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SteamQualificationCheckerApplication.class, args);
    }
}
