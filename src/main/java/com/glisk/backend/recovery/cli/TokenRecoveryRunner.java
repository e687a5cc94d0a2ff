package com.glisk.backend.recovery.cli;

import com.glisk.backend.common.error.ServiceException;
import com.glisk.backend.recovery.RecoveryResult;
import com.glisk.backend.recovery.TokenRecoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Operator command:
 * <pre>
 * java -jar backend.jar --recover-tokens [--limit=N] [--dry-run]
 * </pre>
 * Exit code 0: no gaps or every gap filled; 2: some filled; 1: nothing filled or an error.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class TokenRecoveryRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final String COMMAND = "recover-tokens";

    private final TokenRecoveryService recoveryService;
    private PrintStream out = System.out;
    private volatile int exitCode = 0;

    public static boolean isRecoveryCommand(String[] args) {
        return args != null && Arrays.asList(args).contains("--" + COMMAND);
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(COMMAND)) return;

        try {
            Integer limit = parseLimit(args.getOptionValues("limit"));
            boolean dryRun = args.containsOption("dry-run");
            log.info("cli.started limit={} dryRun={}", limit, dryRun);

            RecoveryResult r = recoveryService.reconcile(limit, dryRun);
            printSummary(r);
            exitCode = exitCodeFor(r);
        } catch (ServiceException e) {
            log.error("cli.recovery_error code={} error={}", e.code(), e.getMessage());
            out.println("Error: " + e.describe());
            exitCode = 1;
        } catch (IllegalArgumentException e) {
            log.error("cli.bad_arguments error={}", e.getMessage());
            out.println("Error: " + e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static int exitCodeFor(RecoveryResult r) {
        if (r.missingCount() == 0) return 0;
        if (r.complete()) return 0;
        if (r.recoveredCount() > 0) return 2;
        return 1;
    }

    private static Integer parseLimit(List<String> values) {
        if (values == null || values.isEmpty()) return null;
        try {
            int v = Integer.parseInt(values.get(0).trim());
            if (v <= 0) throw new IllegalArgumentException("--limit must be positive");
            return v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--limit must be a number: " + values.get(0));
        }
    }

    private void printSummary(RecoveryResult r) {
        String bar = "=".repeat(60);
        out.println();
        out.println(bar);
        out.println("Token Recovery Summary");
        out.println(bar);
        out.println("Next token id on-chain:  " + r.onChainCount());
        out.println("Missing tokens detected: " + r.missingCount());
        out.println("Tokens recovered:        " + r.recoveredCount());
        out.println("Duplicates skipped:      " + r.skippedDuplicates());
        if (r.remainingCount() > 0) {
            out.println("Left for a later run:    " + r.remainingCount());
        }
        for (String e : r.errors()) {
            out.println("  - " + e);
        }
        if (r.dryRun()) {
            out.println();
            out.println("[DRY RUN] No changes were persisted to database");
        }
        out.println(bar);
    }

    void setOut(PrintStream out) {
        this.out = out;
    }
}
