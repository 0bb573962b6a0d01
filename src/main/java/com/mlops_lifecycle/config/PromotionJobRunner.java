package com.mlops_lifecycle.config;

import com.mlops_lifecycle.MlopsLifecycleApp;
import com.mlops_lifecycle.enumeration.PromotionExitCodeEnum;
import com.mlops_lifecycle.service.orchestrator.PromotionOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Runs the promotion job once when the application is started with the {@code promote} command.
 * The exit code reaches the process through {@link org.springframework.boot.SpringApplication#exit}.
 */
@Slf4j
@Component
@Profile(MlopsLifecycleApp.PROMOTE_COMMAND)
@RequiredArgsConstructor
public class PromotionJobRunner implements ApplicationRunner, ExitCodeGenerator {

    private final PromotionOrchestrator promotionOrchestrator;

    private PromotionExitCodeEnum result = PromotionExitCodeEnum.INVALID_INPUT;

    @Override
    public void run(ApplicationArguments args) {
        log.info("🚀 Starting promotion job");
        result = promotionOrchestrator.run();
    }

    @Override
    public int getExitCode() {
        return result.getCode();
    }
}
