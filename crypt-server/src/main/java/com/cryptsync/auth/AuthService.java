package com.cryptsync.auth;

import com.cryptsync.protocol.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Iterator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Issues tokens and tracks authenticated player identities.
 *
 * Thread Safety:
 * - ConcurrentHashMap for both indexes
 * - SecureRandom is thread-safe
 */
public class AuthService {

    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    public static final int MAX_NAME_LENGTH = 24;
    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9 _-]{1," + MAX_NAME_LENGTH + "}");
    private static final int TOKEN_BYTES = 32;

    private final Map<String, PlayerSession> playersByToken = new ConcurrentHashMap<>();
    private final Map<String, PlayerSession> playersById = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();
    private final Duration tokenTtl;
    private final Clock clock;

    public AuthService(Duration tokenTtl, Clock clock) {
        this.tokenTtl = tokenTtl;
        this.clock = clock;
    }

    /**
     * Creates a new identity for a display name.
     *
     * @throws AuthException {@code INVALID_NAME} if the name is empty, too long or
     *                       contains characters other than letters, digits, space, '_' and '-'
     */
    public PlayerSession authenticate(String displayName) {
        String name = validateName(displayName);

        PlayerSession player = new PlayerSession(newToken(), UUID.randomUUID().toString(), name, clock.instant());
        playersByToken.put(player.getToken(), player);
        playersById.put(player.getPlayerId(), player);

        logger.info("Authenticated {} as player {}", name, player.getPlayerId());
        return player;
    }

    /**
     * Resolves a previously issued token.
     *
     * @throws AuthException {@code INVALID_TOKEN} if the token is unknown or expired
     */
    public PlayerSession verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthException(ErrorCode.INVALID_TOKEN, "Token is required");
        }
        PlayerSession player = playersByToken.get(token);
        if (player == null) {
            throw new AuthException(ErrorCode.INVALID_TOKEN, "Unknown token");
        }
        if (isExpired(player, clock.instant())) {
            invalidate(player);
            throw new AuthException(ErrorCode.INVALID_TOKEN, "Token expired");
        }
        return player;
    }

    public PlayerSession getPlayer(String playerId) {
        return playersById.get(playerId);
    }

    public void invalidate(PlayerSession player) {
        playersByToken.remove(player.getToken());
        playersById.remove(player.getPlayerId());
    }

    /**
     * Drops expired identities that are not part of any game.
     *
     * @return number of identities removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<PlayerSession> it = playersByToken.values().iterator();
        while (it.hasNext()) {
            PlayerSession player = it.next();
            if (!player.isInGame() && isExpired(player, now)) {
                it.remove();
                playersById.remove(player.getPlayerId());
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Purged {} expired player tokens", removed);
        }
        return removed;
    }

    public int getPlayerCount() {
        return playersById.size();
    }

    static String validateName(String displayName) {
        if (displayName == null) {
            throw new AuthException(ErrorCode.INVALID_NAME, "Display name is required");
        }
        String name = displayName.trim();
        if (name.isEmpty()) {
            throw new AuthException(ErrorCode.INVALID_NAME, "Display name must not be blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new AuthException(ErrorCode.INVALID_NAME,
                    "Display name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new AuthException(ErrorCode.INVALID_NAME,
                    "Display name may only contain letters, digits, spaces, '_' and '-'");
        }
        return name;
    }

    private boolean isExpired(PlayerSession player, Instant now) {
        return now.isAfter(player.getIssuedAt().plus(tokenTtl));
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
