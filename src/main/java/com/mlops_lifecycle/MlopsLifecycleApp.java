package com.mlops_lifecycle;

import com.mlops_lifecycle.enumeration.PromotionExitCodeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

@Slf4j
@SpringBootApplication
public class MlopsLifecycleApp {

	static {
		// Disable Weka's class discovery cache to prevent ZIP file scanning issues with Spring Boot fat JARs
		System.setProperty("weka.core.ClassDiscovery.enableCache", "false");
	}

	public static final String PROMOTE_COMMAND = "promote";

	public static void main(String[] args) {
		if (args.length > 0 && PROMOTE_COMMAND.equals(args[0])) {
			System.exit(runPromotion(Arrays.copyOfRange(args, 1, args.length)));
		}

		String[] serveArgs = args.length > 0 && "serve".equals(args[0])
				? Arrays.copyOfRange(args, 1, args.length)
				: args;
		SpringApplication.run(MlopsLifecycleApp.class, serveArgs);
	}

	/**
	 * Runs the promotion job in a non-web context and returns its exit code. A context that cannot
	 * start (an unparsable setting such as {@code registry.timeout_ms}) counts as invalid configuration.
	 */
	public static int runPromotion(String[] jobArgs) {
		ConfigurableApplicationContext context;
		try {
			context = new SpringApplicationBuilder(MlopsLifecycleApp.class)
					.web(WebApplicationType.NONE)
					.profiles(PROMOTE_COMMAND)
					.run(jobArgs);
		} catch (RuntimeException e) {
			log.error("❌ Promotion job could not start: {}", e.getMessage());
			return PromotionExitCodeEnum.INVALID_INPUT.getCode();
		}
		return SpringApplication.exit(context);
	}
}
