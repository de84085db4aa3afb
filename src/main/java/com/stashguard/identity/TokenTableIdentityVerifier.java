package com.stashguard.identity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Identity verifier backed by a fixed table of opaque tokens.
 *
 * <p>The table file is a JSON object mapping each credential to its player id.
 */
public class TokenTableIdentityVerifier implements IdentityVerifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenTableIdentityVerifier.class);

    private final Map<String, String> playersByToken;

    public TokenTableIdentityVerifier(Map<String, String> playersByToken) {
        this.playersByToken = Map.copyOf(playersByToken);
    }

    /**
     * Loads a token table from disk.
     *
     * @param tokensFile path to the JSON token table
     * @return the verifier
     * @throws IOException if the file cannot be read or is not a string-to-string object
     */
    public static TokenTableIdentityVerifier load(Path tokensFile) throws IOException {
        if (!Files.exists(tokensFile)) {
            throw new IOException("Token table not found: " + tokensFile);
        }
        ObjectMapper mapper = new ObjectMapper();
        Map<String, String> table = mapper.readValue(tokensFile.toFile(), new TypeReference<Map<String, String>>() {});
        for (Map.Entry<String, String> entry : table.entrySet()) {
            if (entry.getKey().isBlank() || entry.getValue() == null || entry.getValue().isBlank()) {
                throw new IOException("Token table contains a blank credential or player id: " + tokensFile);
            }
        }
        LOGGER.info("Loaded {} credentials from {}", table.size(), tokensFile);
        return new TokenTableIdentityVerifier(table);
    }

    @Override
    public String verify(String credential) throws AuthenticationException {
        if (credential == null || credential.isBlank()) {
            throw new AuthenticationException("Missing credential");
        }
        String playerId = playersByToken.get(credential);
        if (playerId == null) {
            throw new AuthenticationException("Unrecognized credential");
        }
        return playerId;
    }

    public int size() {
        return playersByToken.size();
    }
}
