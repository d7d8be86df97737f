package net.spookly.hchecker.check;

import java.util.Objects;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * One probe cycle's view of a backend as seen from a frontend.
 *
 * <p>The ownership token is only attached once the lock for the backend has been won.
 */
@Getter
@Accessors(fluent = true)
public final class Check {
    private final String backendUrl;
    private final String frontendKey;
    private final int backendPosition;
    private volatile String ownershipToken;

    public Check(String backendUrl, String frontendKey, int backendPosition) {
        this.backendUrl = Objects.requireNonNull(backendUrl, "backendUrl");
        this.frontendKey = Objects.requireNonNull(frontendKey, "frontendKey");
        if (backendPosition < 0) {
            throw new IllegalArgumentException("backend position must not be negative: " + backendPosition);
        }
        this.backendPosition = backendPosition;
    }

    /**
     * Record the token issued for the lock this check won.
     */
    public void attachOwnershipToken(String token) {
        this.ownershipToken = Objects.requireNonNull(token, "token");
    }

    @Override
    public String toString() {
        return "Check{backend=" + backendUrl + ", frontend=" + frontendKey + ", position=" + backendPosition + "}";
    }
}
