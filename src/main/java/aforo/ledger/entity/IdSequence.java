package aforo.ledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Last id handed out for a named entity kind. Ids are never reused, even after removal.
 */
@Entity
@Table(name = "id_sequence")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IdSequence {

    @Id
    @Column(name = "sequence_name", length = 32)
    private String name;

    @Column(name = "last_value", nullable = false)
    private long lastValue;

    public long next() {
        lastValue = lastValue + 1;
        return lastValue;
    }
}
