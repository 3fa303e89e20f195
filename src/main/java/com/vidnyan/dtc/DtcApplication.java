package com.vidnyan.dtc;

import com.vidnyan.dtc.adapter.in.cli.ExitStatus;
import com.vidnyan.dtc.domain.error.CorpusLoadException;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * DTC Lookup - diagnostic trouble code reference.
 *
 * Loads the code corpus, indexes it and answers lookup, list and search commands.
 */
@SpringBootApplication
public class DtcApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context;
        try {
            context = SpringApplication.run(DtcApplication.class, args);
        } catch (RuntimeException e) {
            // Startup failure already reported by Spring Boot's failure analysis
            if (CorpusLoadException.findIn(e) != null) {
                System.exit(ExitStatus.LOAD_FAILURE.code());
            }
            throw e;
        }
        System.exit(SpringApplication.exit(context));
    }
}
