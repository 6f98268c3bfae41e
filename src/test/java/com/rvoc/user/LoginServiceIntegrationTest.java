package com.rvoc.user;

import com.rvoc.PostgresTestSupport;
import com.rvoc.RVocApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = RVocApplication.class, properties = {
        "rvoc.scheduler.enabled=false",
        "rvoc.login.max-login-attempts-per-interval=4",
        "rvoc.login.max-failed-login-attempts-per-interval=2" })
class LoginServiceIntegrationTest extends PostgresTestSupport {

    @Autowired
    LoginService loginService;

    @Autowired
    UserRepository userRepository;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM users");
        loginService.register("alice", "correct horse");
    }

    @Test
    void shouldStoreHashedPassword() {
        User user = userRepository.findById("alice").orElseThrow();

        assertThat(user.getPasswordHash()).isNotBlank().doesNotContain("correct horse");
    }

    @Test
    void shouldAcceptCorrectPasswordAndCountAttempt() {
        assertThatCode(() -> loginService.login("alice", "correct horse")).doesNotThrowAnyException();

        User user = userRepository.findById("alice").orElseThrow();
        assertThat(user.getLoginAttemptCount()).isEqualTo(1);
        assertThat(user.getFailedLoginAttemptCount()).isZero();
    }

    @Test
    void shouldRejectUnknownUser() {
        assertThatThrownBy(() -> loginService.login("bob", "whatever"))
                .isInstanceOfSatisfying(LoginFailedException.class, e -> assertThat(e.getReason())
                        .isEqualTo(LoginFailedException.Reason.INVALID_USERNAME_OR_PASSWORD));
    }

    @Test
    void shouldRateLimitAfterTooManyFailedAttempts() {
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> loginService.login("alice", "wrong"))
                    .isInstanceOfSatisfying(LoginFailedException.class, e -> assertThat(e.getReason())
                            .isEqualTo(LoginFailedException.Reason.INVALID_USERNAME_OR_PASSWORD));
        }

        assertThatThrownBy(() -> loginService.login("alice", "correct horse"))
                .isInstanceOfSatisfying(LoginFailedException.class, e -> assertThat(e.getReason())
                        .isEqualTo(LoginFailedException.Reason.RATE_LIMIT_REACHED));

        User user = userRepository.findById("alice").orElseThrow();
        assertThat(user.getLoginAttemptCount()).isEqualTo(2);
        assertThat(user.getFailedLoginAttemptCount()).isEqualTo(2);
    }

    @Test
    void shouldRateLimitAfterTooManyAttempts() {
        for (int i = 0; i < 4; i++) {
            loginService.login("alice", "correct horse");
        }

        assertThatThrownBy(() -> loginService.login("alice", "correct horse"))
                .isInstanceOfSatisfying(LoginFailedException.class, e -> assertThat(e.getReason())
                        .isEqualTo(LoginFailedException.Reason.RATE_LIMIT_REACHED));
    }
}
