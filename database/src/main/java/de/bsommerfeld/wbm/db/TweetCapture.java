package de.bsommerfeld.wbm.db;

import de.bsommerfeld.wbm.core.domain.BrowserTweet;

/**
 * A stored tweet revision together with the digest of a capture that
 * contained it.
 */
public record TweetCapture(BrowserTweet tweet, String digest) {
}
