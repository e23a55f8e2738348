package io.github.drompincen.complianceboard.gateway;

import io.github.drompincen.complianceboard.runtime.config.ComplianceBoardProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.complianceboard")
@EnableConfigurationProperties(ComplianceBoardProperties.class)
@EnableScheduling
public class ComplianceBoardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComplianceBoardApplication.class, args);
    }
}
