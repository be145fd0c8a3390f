package com.paymentsengine.csv;

import com.paymentsengine.accounts.AccountView;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;

/**
 * Writes account snapshots as CSV: {@code client,available,held,total,locked}.
 * Amounts always carry four fractional digits.
 */
public class AccountCsvWriter {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader("client", "available", "held", "total", "locked")
        .setRecordSeparator("\n")
        .build();

    /**
     * Write the header and one row per account, in the order given. The target is flushed, not closed.
     */
    public void write(Iterable<AccountView> accounts, Appendable out) throws IOException {
        CSVPrinter printer = new CSVPrinter(out, FORMAT);
        for (AccountView account : accounts) {
            printer.printRecord(
                account.getClientId(),
                account.getAvailable().toDisplayString(),
                account.getHeld().toDisplayString(),
                account.getTotal().toDisplayString(),
                account.isLocked());
        }
        printer.flush();
    }
}
