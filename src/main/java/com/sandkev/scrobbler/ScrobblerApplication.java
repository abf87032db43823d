package com.sandkev.scrobbler;

import com.sandkev.scrobbler.cli.CliArgs;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

@SpringBootApplication
public class ScrobblerApplication {

	public static void main(String[] args) {
		CliArgs cli;
		try {
			cli = CliArgs.parse(args);
		} catch (IllegalArgumentException e) {
			System.err.println(e.getMessage() + "\n");
			System.err.println(CliArgs.USAGE);
			System.exit(1);
			return;
		}

		int exitCode;
		try {
			// command line properties win over application.yml
			String[] withStore = Arrays.copyOf(args, args.length + 2);
			withStore[args.length] = "--spring.datasource.url=" + cli.jdbcUrl();
			withStore[args.length + 1] = "--scrobbler.command=" + cli.command().cliName();

			ConfigurableApplicationContext ctx = new SpringApplicationBuilder(ScrobblerApplication.class)
					.run(withStore);
			exitCode = SpringApplication.exit(ctx);
		} catch (RuntimeException e) {
			// Spring Boot has already logged the failure
			exitCode = 1;
		}
		System.exit(exitCode);
	}

}
