package es.hargos.tenantguard.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BalanceResponse {

    /**
     * Minor units (cents)
     */
    private long balance;
    private String currency;
}
