package de.bsommerfeld.wbm.archive;

import de.bsommerfeld.wbm.archive.digest.Digests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Digests a flat directory of gzip captures that were downloaded before being
 * folded into the sharded store. Each file is named by its intended identity;
 * the listing lets callers check or regenerate those names.
 */
public final class ArchiveBootstrap {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveBootstrap.class);

    private ArchiveBootstrap() {
    }

    /**
     * Computes the gzip-aware digest of every regular file directly inside
     * {@code dir}. Subdirectories are skipped. A file that fails to inflate is
     * logged and left out. Results are sorted by name.
     *
     * @throws ArchiveException if {@code dir} cannot be listed
     */
    public static List<RawDigest> computeRawDigests(Path dir) throws ArchiveException {
        List<RawDigest> results = new ArrayList<>();

        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                if (!Files.isRegularFile(entry)) {
                    LOG.info("Ignoring directory: {}", entry);
                    continue;
                }
                String name = stem(entry.getFileName().toString());
                try {
                    results.add(new RawDigest(name, Digests.computeDigestGz(entry)));
                } catch (ArchiveException e) {
                    LOG.error("Error at {}: {}", name, e.toString());
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            throw new ArchiveException(ArchiveException.Kind.IO, "Failed to list " + dir, e);
        }

        results.sort(Comparator.comparing(RawDigest::name));
        return results;
    }

    /** File name without its last extension. */
    static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
