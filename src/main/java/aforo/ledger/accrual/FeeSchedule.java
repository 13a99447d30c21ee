package aforo.ledger.accrual;

import aforo.ledger.entity.FeeEntry;
import aforo.ledger.exception.LedgerStateException;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered rate history of one provider, operating directly on the provider's entry list.
 *
 * <p>Entries tile time without gaps. The last entry is open-ended: it ends at
 * {@link #OPEN_END} until a new rate supersedes it. Earnings are measured in whole hours
 * per entry; a partial hour inside one entry contributes nothing.
 */
public class FeeSchedule {

    /**
     * End of the open entry. Kept inside the range of SQL timestamp columns.
     */
    public static final Instant OPEN_END = Instant.parse("9999-12-31T23:59:59Z");

    private final List<FeeEntry> entries;

    public FeeSchedule(List<FeeEntry> entries) {
        this.entries = Objects.requireNonNull(entries, "entries");
    }

    /**
     * Seeds an empty schedule with one open-ended entry starting at {@code now}.
     */
    public void open(long amount, Instant now) {
        if (!entries.isEmpty()) {
            throw new LedgerStateException("Fee schedule already holds " + entries.size() + " entries");
        }
        entries.add(new FeeEntry(now, OPEN_END, amount));
    }

    public long currentRate() {
        return openEntry().getAmount();
    }

    /**
     * Closes the open entry at {@code now} and opens a new one at {@code amount}.
     * A rate set at the very instant the open entry started replaces that entry's amount.
     */
    public void appendRate(long amount, Instant now) {
        int last = entries.size() - 1;
        FeeEntry open = openEntry();
        if (now.isBefore(open.getStart())) {
            throw new LedgerStateException("Rate change at " + now + " precedes the open entry starting " + open.getStart());
        }
        if (now.equals(open.getStart())) {
            entries.set(last, open.withAmount(amount));
            return;
        }
        entries.set(last, open.closedAt(now));
        entries.add(new FeeEntry(now, OPEN_END, amount));
    }

    /**
     * Retires everything before {@code timestamp}: entries ending at or before it are dropped
     * and the first remaining entry is moved to start at {@code timestamp}.
     */
    public void pruneBefore(Instant timestamp) {
        while (entries.size() > 1 && !entries.get(0).getEnd().isAfter(timestamp)) {
            entries.remove(0);
        }
        FeeEntry first = entries.get(0);
        if (first.getStart().isBefore(timestamp) && first.getEnd().isAfter(timestamp)) {
            entries.set(0, first.startingAt(timestamp));
        }
    }

    /**
     * Amount accrued over {@code [joinedAt, until)}: for each entry, the whole hours of overlap
     * times the entry's rate.
     */
    public long earningsFor(Instant joinedAt, Instant until) {
        if (!until.isAfter(joinedAt)) {
            return 0L;
        }
        long total = 0L;
        for (FeeEntry entry : entries) {
            Instant from = joinedAt.isAfter(entry.getStart()) ? joinedAt : entry.getStart();
            Instant to = until.isBefore(entry.getEnd()) ? until : entry.getEnd();
            if (!to.isAfter(from)) {
                continue;
            }
            long hours = Duration.between(from, to).toHours();
            total = LedgerMath.add(total, LedgerMath.multiply(hours, entry.getAmount()));
        }
        return total;
    }

    public List<FeeEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    private FeeEntry openEntry() {
        if (entries.isEmpty()) {
            throw new LedgerStateException("Fee schedule is empty");
        }
        return entries.get(entries.size() - 1);
    }
}
