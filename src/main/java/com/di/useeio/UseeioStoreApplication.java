package com.di.useeio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Installs the USEEIO schema, refreshes the IPCC GWP reference data and reports
 * the active methodology, then exits.
 *
 * <p>The data source, transaction manager and Flyway are wired by
 * {@link com.di.useeio.config.StoreDataSourceConfig} from {@code useeio.store.*}
 * instead of Spring Boot's auto-configuration.
 */
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class,
		FlywayAutoConfiguration.class
})
@EnableAspectJAutoProxy(proxyTargetClass = false)
@ConfigurationPropertiesScan
public class UseeioStoreApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(UseeioStoreApplication.class, args)));
	}
}
