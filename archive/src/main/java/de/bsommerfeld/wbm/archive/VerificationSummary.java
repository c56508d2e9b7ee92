package de.bsommerfeld.wbm.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Counts of a verification run: entries whose content still matches their
 * digest, entries whose content changed, and entries that could not be read.
 */
public record VerificationSummary(long valid, long invalid, long broken) {

    private static final Logger LOG = LoggerFactory.getLogger(VerificationSummary.class);

    public boolean isClean() {
        return invalid == 0 && broken == 0;
    }

    /**
     * Consumes {@code results} and tallies them. Every invalid and broken entry
     * is logged as it arrives. The stream is not closed.
     */
    public static VerificationSummary tally(Stream<Outcome<DigestPair>> results) {
        long valid = 0;
        long invalid = 0;
        long broken = 0;

        Iterator<Outcome<DigestPair>> it = results.iterator();
        while (it.hasNext()) {
            Outcome<DigestPair> result = it.next();
            if (result instanceof Outcome.Success<DigestPair> success) {
                DigestPair pair = success.value();
                if (pair.isValid()) {
                    valid++;
                } else {
                    LOG.error("Invalid digest: expected {}, got {}", pair.expected(), pair.actual());
                    invalid++;
                }
            } else {
                LOG.error("Broken entry: {}", result.errorOrNull().getMessage(), result.errorOrNull());
                broken++;
            }
        }

        VerificationSummary summary = new VerificationSummary(valid, invalid, broken);
        LOG.info("Valid: {}; invalid: {}; broken: {}", valid, invalid, broken);
        return summary;
    }
}
