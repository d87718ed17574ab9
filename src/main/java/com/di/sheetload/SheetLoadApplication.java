package com.di.sheetload;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.util.Arrays;

// The backend is resolved per run, so no DataSource is created at boot.
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
public class SheetLoadApplication {

	static final String COMMAND_ARG = "--sheetload.command=";

	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(SheetLoadApplication.class);
		// One-shot command runs do not need the web server.
		if (Arrays.stream(args).anyMatch(arg -> arg.startsWith(COMMAND_ARG))) {
			application.setWebApplicationType(WebApplicationType.NONE);
		}
		application.run(args);
	}
}
