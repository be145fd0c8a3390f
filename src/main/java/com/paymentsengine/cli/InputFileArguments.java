package com.paymentsengine.cli;

import com.paymentsengine.common.exception.InvalidArgumentsException;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Extracts the input file from the command line.
 *
 * The first argument names the transactions file and must end in {@code .csv}.
 * A name that is only an extension, such as {@code ".csv"}, is refused.
 * Further arguments are ignored.
 */
public final class InputFileArguments {

    private static final String CSV_EXTENSION = "csv";

    private InputFileArguments() {
    }

    public static Path parse(String[] args) {
        if (args == null || args.length < 1) {
            throw new InvalidArgumentsException(InvalidArgumentsException.Reason.ARGUMENTS_TOO_SHORT,
                "Usage: payments-engine <transactions.csv>");
        }
        String fileArg = args[0];
        if (!hasCsvExtension(fileArg)) {
            throw new InvalidArgumentsException(InvalidArgumentsException.Reason.EXPECTED_CSV_FILE,
                "Expected a .csv file, got: '" + fileArg + "'");
        }
        return Paths.get(fileArg);
    }

    static boolean hasCsvExtension(String fileArg) {
        if (fileArg == null) {
            return false;
        }
        String fileName = fileArg.substring(Math.max(fileArg.lastIndexOf('/'), fileArg.lastIndexOf('\\')) + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return false;
        }
        return fileName.substring(dot + 1).equals(CSV_EXTENSION);
    }
}
