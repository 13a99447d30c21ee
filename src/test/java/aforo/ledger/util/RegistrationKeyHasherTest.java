package aforo.ledger.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Registration Key Hasher Tests")
class RegistrationKeyHasherTest {

    @Test
    @DisplayName("Should produce the lowercase hex SHA-256 digest")
    void shouldProduceSha256Hex() {
        String digest = RegistrationKeyHasher.digest("abc".getBytes(StandardCharsets.UTF_8));

        assertThat(digest).isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("Should be deterministic and distinguish keys")
    void shouldBeDeterministic() {
        byte[] key = {1, 2, 3};

        assertThat(RegistrationKeyHasher.digest(key)).isEqualTo(RegistrationKeyHasher.digest(key.clone()));
        assertThat(RegistrationKeyHasher.digest(key)).isNotEqualTo(RegistrationKeyHasher.digest(new byte[] {1, 2, 4}));
    }

    @Test
    @DisplayName("Should reject a null key")
    void shouldRejectNull() {
        assertThatThrownBy(() -> RegistrationKeyHasher.digest(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
