package es.hargos.tenantguard.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TenantEntity")
class TenantEntityTest {

    @Test
    @DisplayName("first credit sets the balance currency, later credits keep it")
    void addCredit() {
        TenantEntity tenant = TenantEntity.builder().name("Acme").slug("acme").ownerId(1L).build();

        assertThat(tenant.addCredit(5000, "eur")).isEqualTo(5000);
        assertThat(tenant.getBalanceCurrency()).isEqualTo("eur");

        assertThat(tenant.addCredit(250, "usd")).isEqualTo(5250);
        assertThat(tenant.getBalanceCurrency()).isEqualTo("eur");
    }

    @Test
    @DisplayName("missing currency falls back to usd")
    void defaultCurrency() {
        TenantEntity tenant = TenantEntity.builder().name("Acme").slug("acme").ownerId(1L).build();

        tenant.addCredit(100, null);

        assertThat(tenant.getBalanceCurrency()).isEqualTo(TenantEntity.DEFAULT_CURRENCY);
    }
}
