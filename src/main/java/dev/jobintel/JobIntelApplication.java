package dev.jobintel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class JobIntelApplication implements CommandLineRunner {

    private final PipelineRunner pipelineRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(JobIntelApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            pipelineRunner.execute();
            log.info("Job Intel exiting...");
            exitManager.exit(0);
        } catch (Exception e) {
            log.error("Job Intel failed: {}", e.getMessage());
            exitManager.exit(1);
        }
    }
}
