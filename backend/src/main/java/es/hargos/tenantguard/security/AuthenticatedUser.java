package es.hargos.tenantguard.security;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Principal stored in the Spring Security context after bearer token validation.
 */
@Getter
@ToString
@AllArgsConstructor
public class AuthenticatedUser {

    private final Long userId;
    private final String email;
    private final boolean superAdmin;
}
