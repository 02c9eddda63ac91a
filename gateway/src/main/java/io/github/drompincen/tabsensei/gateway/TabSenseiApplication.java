package io.github.drompincen.tabsensei.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.tabsensei")
@EnableScheduling
public class TabSenseiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TabSenseiApplication.class, args);
    }
}
