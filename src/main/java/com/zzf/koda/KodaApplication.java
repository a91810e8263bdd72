package com.zzf.koda;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.net.URI;

@SpringBootApplication
@EnableScheduling
public class KodaApplication {
    private static final Logger logger = LoggerFactory.getLogger(KodaApplication.class);

    public static void main(String[] args) {
        guardRuntimeClasses();
        SpringApplication.run(KodaApplication.class, args);
    }

    private static void guardRuntimeClasses() {
        try {
            URI location = KodaApplication.class.getProtectionDomain().getCodeSource().getLocation().toURI();
            String path = location == null ? "" : location.getPath();
            String normalized = path.replace('\\', '/');
            if (normalized.contains("/out/production/")) {
                logger.error("runtime.classpath.invalid location={}", path);
                throw new IllegalStateException("Detected IDE out/production classes on classpath. Please run via Maven (spring-boot:run) or use target/classes output.");
            }
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            logger.warn("runtime.classpath.check.failed err={}", e.toString());
        }
    }
}
