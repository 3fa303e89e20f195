package com.vidnyan.dtc.adapter.in.cli;

import com.vidnyan.dtc.DtcProperties;
import com.vidnyan.dtc.adapter.out.format.ResultFormatters;
import com.vidnyan.dtc.application.port.in.CodeQueryUseCase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Command line runner for the diagnostic code tool.
 * Runs one command on startup; the outcome becomes the process exit code.
 */
@Slf4j
@Component
public class DiagnosticCliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final CodeQueryUseCase queries;
    private final ResultFormatters formatters;
    private final DtcProperties properties;

    private volatile ExitStatus status = ExitStatus.OK;

    public DiagnosticCliRunner(CodeQueryUseCase queries, ResultFormatters formatters, DtcProperties properties) {
        this.queries = queries;
        this.formatters = formatters;
        this.properties = properties;
    }

    @Override
    public void run(String... args) throws Exception {
        if (!properties.getCli().isEnabled()) {
            log.info("CLI is disabled. Set dtc.cli.enabled=true to run commands.");
            return;
        }

        CliCommandExecutor executor = new CliCommandExecutor(queries, formatters, System.out, System.err);
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        status = executor.execute(Arrays.asList(args), stdin);
        log.debug("Command finished with {}", status);
    }

    @Override
    public int getExitCode() {
        return status.code();
    }

    public ExitStatus getStatus() {
        return status;
    }
}
