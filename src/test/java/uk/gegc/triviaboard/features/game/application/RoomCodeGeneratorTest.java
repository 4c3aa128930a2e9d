package uk.gegc.triviaboard.features.game.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.triviaboard.features.game.config.GameProperties;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RoomCodeGenerator")
class RoomCodeGeneratorTest {

    @Test
    @DisplayName("codes use uppercase letters and digits at the configured length")
    void next_format() {
        GameProperties properties = new GameProperties();
        properties.setRoomCodeLength(8);
        RoomCodeGenerator generator = new RoomCodeGenerator(properties);

        for (int i = 0; i < 100; i++) {
            assertThat(generator.next()).matches("[A-Z0-9]{8}");
        }
    }
}
