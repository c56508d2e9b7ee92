package de.bsommerfeld.wbm.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * Everything observed about one Twitter account across all captures. Screen
 * names and display names are listed in the order they were first recorded.
 *
 * @param id          numeric Twitter id
 * @param lastSeen    timestamp of the newest tweet by this account, or
 *                    {@code null} when no tweet references it
 * @param screenNames every screen name seen for the account
 * @param names       every display name seen for the account
 */
public record UserRecord(long id, Instant lastSeen, List<String> screenNames, List<String> names) {

    public UserRecord {
        screenNames = screenNames != null ? List.copyOf(screenNames) : List.of();
        names = names != null ? List.copyOf(names) : List.of();
    }
}
