package de.bsommerfeld.wbm.archive;

/**
 * A bootstrap file name paired with the digest of its inflated content.
 */
public record RawDigest(String name, String digest) {

    public String toCsvLine() {
        return name + "," + digest;
    }
}
