package uk.gegc.triviaboard.shared.security;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Facilitator accounts allowed to launch and run games. Passwords use the
 * {@link org.springframework.security.crypto.password.DelegatingPasswordEncoder} format, e.g. {@code {bcrypt}$2a$...}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "triviaboard.security")
public class FacilitatorProperties {

    private List<Account> facilitators = new ArrayList<>();

    @Data
    public static class Account {
        private String username;
        private String password;
    }
}
