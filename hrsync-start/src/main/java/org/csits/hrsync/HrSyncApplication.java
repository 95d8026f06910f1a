package org.csits.hrsync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.hrsync.dao.JobRunEntity;
import org.csits.hrsync.server.dto.FieldTarget;
import org.csits.hrsync.server.service.BatchJobService;
import org.csits.hrsync.server.service.SyncConfigService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * 启动类，可通过命令行参数在启动时开始批量作业，之后由周期触发续跑。
 *
 * 示例：
 *  java -jar hrsync-start.jar --target=department
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "org.csits.hrsync")
@RequiredArgsConstructor
public class HrSyncApplication implements CommandLineRunner {

    private static final String TARGET_ARG = "--target=";

    private final SyncConfigService syncConfigService;
    private final BatchJobService batchJobService;

    public static void main(String[] args) {
        SpringApplication.run(HrSyncApplication.class, args);
    }

    @Override
    public void run(String... args) {
        String targetName = null;
        for (String arg : args) {
            if (arg.startsWith(TARGET_ARG)) {
                targetName = arg.substring(TARGET_ARG.length());
            }
        }
        if (targetName == null || targetName.trim().isEmpty()) {
            log.info("未指定 target，以常驻模式启动");
            return;
        }
        if (batchJobService.isJobActive()) {
            log.warn("已有批量作业在执行，忽略启动参数 target={}，由周期触发继续处理", targetName);
            return;
        }
        FieldTarget target = syncConfigService.resolveTarget(targetName);
        JobRunEntity run = batchJobService.startJob(target);
        log.info("批量作业已启动: batchNumber={}, target={}, rows={}", run.getBatchNumber(), targetName, run.getTotalRows());
    }
}
