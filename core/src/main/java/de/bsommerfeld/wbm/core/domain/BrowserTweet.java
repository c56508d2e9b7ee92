package de.bsommerfeld.wbm.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A single tweet as rendered in a captured page. Instances are produced by the
 * HTML parser upstream and are immutable snapshots of what the capture showed,
 * which is why two captures of the same status id may carry different text
 * (e.g. a truncated preview and the full tweet).
 *
 * @param id             status id of the tweet
 * @param parentId       status id of the tweet this one replies to, or
 *                       {@code null} when it is not a reply
 * @param time           creation time, second precision
 * @param userId         numeric id of the author
 * @param userScreenName author handle as shown in the capture
 * @param userName       author display name as shown in the capture
 * @param text           tweet text
 */
public record BrowserTweet(
        long id,
        Long parentId,
        Instant time,
        long userId,
        String userScreenName,
        String userName,
        String text) {

    public BrowserTweet {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(userScreenName, "userScreenName");
        Objects.requireNonNull(userName, "userName");
        Objects.requireNonNull(text, "text");
    }

    /**
     * Parent id in the stored form: a tweet without a parent points at itself.
     */
    public long parentIdOrSelf() {
        return parentId != null ? parentId : id;
    }
}
