package es.hargos.tenantguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@EnableJpaRepositories(basePackages = "es.hargos.tenantguard.repository")
@EntityScan(basePackages = "es.hargos.tenantguard.entity")
@SpringBootApplication
public class TenantGuardApplication {

	public static void main(String[] args) {
		SpringApplication.run(TenantGuardApplication.class, args);
	}

}
