package uk.gegc.triviaboard.features.game.application;

import org.springframework.stereotype.Component;
import uk.gegc.triviaboard.features.game.config.GameProperties;

import java.security.SecureRandom;

@Component
public class RoomCodeGenerator {

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final SecureRandom random = new SecureRandom();
    private final GameProperties properties;

    public RoomCodeGenerator(GameProperties properties) {
        this.properties = properties;
    }

    public String next() {
        StringBuilder code = new StringBuilder(properties.getRoomCodeLength());
        for (int i = 0; i < properties.getRoomCodeLength(); i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }
}
