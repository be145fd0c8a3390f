package com.paymentsengine.cli;

import com.paymentsengine.common.PrecisionPolicy;
import com.paymentsengine.common.exception.PaymentsEngineException;
import com.paymentsengine.csv.AccountCsvWriter;
import com.paymentsengine.csv.TransactionCsvReader;
import com.paymentsengine.engine.ProcessingResult;
import com.paymentsengine.engine.TransactionEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Command-line entry point: reads the CSV named by the first argument, runs the engine,
 * and prints the resulting account snapshot as CSV on standard output.
 *
 * Logs go to standard error so the snapshot can be redirected on its own.
 */
@Component
@ConditionalOnProperty(name = "payments-engine.cli.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class PaymentsEngineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_INVALID_ARGUMENTS = 2;
    static final int EXIT_PROCESSING_FAILED = 1;

    private final TransactionEngine engine;

    private final AccountCsvWriter writer;

    private final PrecisionPolicy precisionPolicy;

    private final PrintStream out;

    private int exitCode;

    @Autowired
    public PaymentsEngineRunner(TransactionEngine engine,
                                @Value("${payments-engine.amount.precision-policy:TRUNCATE}")
                                PrecisionPolicy precisionPolicy) {
        this(engine, new AccountCsvWriter(), precisionPolicy, System.out);
    }

    PaymentsEngineRunner(TransactionEngine engine, AccountCsvWriter writer,
                         PrecisionPolicy precisionPolicy, PrintStream out) {
        this.engine = engine;
        this.writer = writer;
        this.precisionPolicy = precisionPolicy;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getSourceArgs());
    }

    int execute(String[] args) {
        Path input;
        try {
            input = InputFileArguments.parse(args);
        } catch (PaymentsEngineException e) {
            log.error(e.getMessage());
            return EXIT_INVALID_ARGUMENTS;
        }

        log.info("Processing transactions from {} (precision policy {})", input, precisionPolicy);

        try (TransactionCsvReader reader = TransactionCsvReader.open(input, precisionPolicy)) {
            ProcessingResult result = engine.process(reader);
            if (reader.getSkipped() > 0) {
                log.warn("Skipped {} malformed rows in {}", reader.getSkipped(), input);
            }
            writer.write(result.getAccounts(), out);
            if (out.checkError()) {
                log.error("Failed to write account snapshot for {}", input);
                return EXIT_PROCESSING_FAILED;
            }
            return result.isComplete() ? 0 : EXIT_PROCESSING_FAILED;
        } catch (IOException | UncheckedIOException e) {
            log.error("Failed to process {}: {}", input, e.getMessage(), e);
            return EXIT_PROCESSING_FAILED;
        } catch (PaymentsEngineException e) {
            log.error("Aborted processing {}: {}", input, e.getMessage(), e);
            return EXIT_PROCESSING_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
