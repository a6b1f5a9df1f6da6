package com.gridintel.ingest;

import com.gridintel.ingest.cli.CliArguments;
import com.gridintel.ingest.exception.InvalidDatasetException;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class MarketIngestorApplication {

    public static void main(String[] args) {
        String[] normalized = CliArguments.normalize(args);

        if (!CliArguments.isCliInvocation(normalized)) {
            SpringApplication.run(MarketIngestorApplication.class, normalized);
            return;
        }

        // One-shot run: no web server, no scheduler, exit code from the runner
        List<String> cliArgs = new ArrayList<>(Arrays.asList(normalized));
        cliArgs.add("--ingestor.scheduling.enabled=false");
        if (cliArgs.contains("--debug")) {
            cliArgs.add("--logging.level.com.gridintel=DEBUG");
        }

        SpringApplication app = new SpringApplication(MarketIngestorApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        try {
            System.exit(SpringApplication.exit(app.run(cliArgs.toArray(new String[0]))));
        } catch (RuntimeException e) {
            Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
            System.exit(cause instanceof InvalidDatasetException ? 2 : 1);
        }
    }
}
