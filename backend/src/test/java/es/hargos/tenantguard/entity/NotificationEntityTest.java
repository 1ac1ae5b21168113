package es.hargos.tenantguard.entity;

import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.SequenceGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NotificationEntity")
class NotificationEntityTest {

    @Test
    @DisplayName("ids come from the table sequence so inserts need no RETURNING")
    void sequenceGeneratedId() throws NoSuchFieldException {
        Field id = NotificationEntity.class.getDeclaredField("id");

        GeneratedValue generated = id.getAnnotation(GeneratedValue.class);
        SequenceGenerator sequence = id.getAnnotation(SequenceGenerator.class);

        assertThat(generated.strategy()).isEqualTo(GenerationType.SEQUENCE);
        assertThat(sequence).isNotNull();
        assertThat(sequence.name()).isEqualTo(generated.generator());
        assertThat(sequence.sequenceName()).isEqualTo("public.notifications_id_seq");
        assertThat(sequence.allocationSize()).isEqualTo(1);
    }
}
