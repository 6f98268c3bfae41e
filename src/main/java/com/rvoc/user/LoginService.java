package com.rvoc.user;

import com.rvoc.config.RVocProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Password login with per-user rate limiting. The user row is locked for the whole check, so
 * concurrent logins and the counter reset job never lose an update.
 */
@Service
public class LoginService {

    private static final Logger log = LoggerFactory.getLogger(LoginService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final RVocProperties.Login properties;

    public LoginService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            TransactionTemplate transactionTemplate,
            Clock clock,
            RVocProperties properties) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.properties = properties.getLogin();
    }

    /**
     * Checks {@code password} against the stored hash of {@code username}.
     *
     * @throws LoginFailedException if the user is unknown, the password is wrong, or the user has
     *                              used up the allowed attempts of the current counting interval
     */
    public void login(String username, String password) {
        LoginFailedException.Reason failure = transactionTemplate.execute(status -> attempt(username, password));
        if (failure != null) {
            throw new LoginFailedException(failure);
        }
    }

    /**
     * Stores a new user with a hashed password.
     */
    public User register(String username, String password) {
        User user = new User(username, passwordEncoder.encode(password), OffsetDateTime.now(clock));
        return transactionTemplate.execute(status -> userRepository.save(user));
    }

    private LoginFailedException.Reason attempt(String username, String password) {
        User user = userRepository.findByNameForUpdate(username).orElse(null);
        if (user == null) {
            log.debug("Login attempt for unknown user {}", username);
            return LoginFailedException.Reason.INVALID_USERNAME_OR_PASSWORD;
        }

        User.LoginLimits limits = new User.LoginLimits(
                properties.getMaxLoginAttemptsPerInterval(),
                properties.getMaxFailedLoginAttemptsPerInterval(),
                properties.getLoginAttemptCountingInterval());
        if (!user.tryLoginAttempt(OffsetDateTime.now(clock), limits)) {
            log.info("Login rate limit reached for user {}", username);
            return LoginFailedException.Reason.RATE_LIMIT_REACHED;
        }

        if (user.getPasswordHash() == null || !passwordEncoder.matches(password, user.getPasswordHash())) {
            user.failLoginAttempt();
            log.debug("Wrong password for user {} ({} failed attempts)", username, user.getFailedLoginAttemptCount());
            return LoginFailedException.Reason.INVALID_USERNAME_OR_PASSWORD;
        }
        return null;
    }
}
