package aforo.ledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * SHA-256 digest of a provider registration key that has already been used.
 */
@Entity
@Table(name = "consumed_registration_key")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConsumedRegistrationKey {

    @Id
    @Column(name = "digest", length = 64)
    private String digest;

    @Column(name = "consumed_at", nullable = false)
    private Instant consumedAt;
}
