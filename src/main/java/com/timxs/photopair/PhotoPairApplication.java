package com.timxs.photopair;

import com.timxs.photopair.exception.BatchProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.nio.file.Path;

/**
 * 命令行入口
 * 用法：photo-pair-compositor &lt;左侧目录&gt; &lt;右侧目录&gt; [输出目录]
 *
 * @author Tim0x0
 * @since 1.0.0
 */
@Slf4j
public final class PhotoPairApplication {

    static final int EXIT_OK = 0;

    static final int EXIT_FAILURE = 1;

    static final int EXIT_USAGE = 2;

    private PhotoPairApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * 启动 Spring 容器并执行合成
     *
     * @param args 命令行参数
     * @return 退出码
     */
    static int run(String[] args) {
        if (args == null || args.length < 2 || args.length > 3) {
            log.error("Usage: photo-pair-compositor <leftDir> <rightDir> [outputDir]");
            return EXIT_USAGE;
        }
        System.setProperty("java.awt.headless", "true");

        Path leftDirectory = Path.of(args[0]);
        Path rightDirectory = Path.of(args[1]);
        Path outputDirectory = Path.of(args.length == 3 ? args[2] : ".");

        log.info("Photo Pair Compositor 启动中...");
        try (AnnotationConfigApplicationContext context =
                 new AnnotationConfigApplicationContext(PhotoPairConfiguration.class)) {
            Path archive = context.getBean(PhotoPairRunner.class)
                .run(leftDirectory, rightDirectory, outputDirectory)
                .block();
            log.info("处理完成: {}", archive);
            return EXIT_OK;
        } catch (BatchProcessingException e) {
            log.error("第 {} 对照片处理失败: {}", e.getPairIndex() + 1, e.getMessage(), e.getCause());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("处理失败: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }
}
