package com.ihome.passport.credential;

import com.ihome.passport.user.User;
import com.ihome.passport.user.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CredentialValidatorTest {

    private UserService userService;
    private CredentialValidator validator;

    @BeforeEach
    void setUp() {
        PasswordEncoder encoder = new BCryptPasswordEncoder(4);
        userService = mock(UserService.class);
        when(userService.findByMobile("13800001111")).thenReturn(Optional.of(User.builder()
                .id(7L)
                .name("13800001111")
                .mobile("13800001111")
                .passwordHash(encoder.encode("s3cret-pass"))
                .build()));
        when(userService.findByMobile("13900002222")).thenReturn(Optional.empty());
        validator = new CredentialValidator(userService, encoder);
    }

    @Test
    void correctSecretAuthenticates() {
        CredentialCheckResult result = validator.check("13800001111", "s3cret-pass");

        assertThat(result.status()).isEqualTo(CredentialStatus.AUTHENTICATED);
        assertThat(result.principal()).isEqualTo(new AuthenticatedPrincipal(7L, "13800001111", "13800001111"));
    }

    @Test
    void unknownIdentityAndWrongSecretAreIndistinguishable() {
        CredentialCheckResult unknown = validator.check("13900002222", "s3cret-pass");
        CredentialCheckResult wrong = validator.check("13800001111", "not-it");

        assertThat(unknown).isEqualTo(wrong);
        assertThat(unknown.status()).isEqualTo(CredentialStatus.INVALID_CREDENTIALS);
        assertThat(unknown.principal()).isNull();
    }

    @Test
    void userWithoutPasswordHashCannotLogIn() {
        when(userService.findByMobile("13700003333")).thenReturn(Optional.of(User.builder()
                .id(8L)
                .name("13700003333")
                .mobile("13700003333")
                .build()));

        assertThat(validator.check("13700003333", "placeholder-credential").status())
                .isEqualTo(CredentialStatus.INVALID_CREDENTIALS);
    }

    @Test
    void userStoreFailureIsReportedSeparately() {
        when(userService.findByMobile("13600004444")).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThat(validator.check("13600004444", "whatever").status()).isEqualTo(CredentialStatus.STORE_UNAVAILABLE);
    }

    @Test
    void transactionStartFailureIsReportedAsStoreUnavailable() {
        when(userService.findByMobile("13500005555"))
                .thenThrow(new CannotCreateTransactionException("Could not open JDBC Connection for transaction"));

        assertThat(validator.check("13500005555", "whatever").status()).isEqualTo(CredentialStatus.STORE_UNAVAILABLE);
    }
}
