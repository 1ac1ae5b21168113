package es.hargos.tenantguard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Usage against one limit. Null limit and remaining mean unlimited.
 * Using exactly the limit is not exceeded.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuotaMetric {

    private Integer limit;
    private long used;
    private Long remaining;
    private boolean exceeded;

    public static QuotaMetric of(Integer limit, long used) {
        if (limit == null) {
            return new QuotaMetric(null, used, null, false);
        }
        return new QuotaMetric(limit, used, Math.max(0L, limit - used), used > limit);
    }
}
