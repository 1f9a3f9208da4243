package work.pollochang.duplicate.image;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import work.pollochang.duplicate.image.cache.CachedHashes;
import work.pollochang.duplicate.image.cache.FileKey;
import work.pollochang.duplicate.image.cache.HashCacheManager;
import work.pollochang.duplicate.image.core.DetectionConfig;
import work.pollochang.duplicate.image.core.DetectionResult;
import work.pollochang.duplicate.image.core.DuplicateDetector;
import work.pollochang.duplicate.image.core.ProviderUnstableException;
import work.pollochang.duplicate.image.report.ResultWriter;
import work.pollochang.duplicate.image.tools.FileTools;

import java.io.File;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Slf4j
@Command(name = "image-duplicate-checker",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "重複圖片偵測工具")
public class Execute implements Callable<Integer> {

    static final int EXIT_FATAL = 1;

    /** 收到中斷訊號後等待結果與快取寫出的最長時間 */
    static final long SHUTDOWN_WAIT_SECONDS = 60;

    @Parameters(index = "0", description = "要檢查的圖片目錄。")
    private File directory;

    @Option(names = {"-r", "--recursive"}, description = "包含子目錄。")
    private boolean recursive;

    @Option(names = {"-d", "--dhash"}, defaultValue = "8", description = "差值雜湊門檻 (預設: 8)。")
    private int dhashThreshold;

    @Option(names = {"-a", "--ahash"}, defaultValue = "2", description = "平均雜湊門檻 (預設: 2)。")
    private int ahashThreshold;

    @Option(names = {"-p", "--phash"}, defaultValue = "2", description = "頻域雜湊門檻 (預設: 2)。")
    private int phashThreshold;

    @Option(names = {"--no-pure-color-detection"}, description = "停用純色圖片檢測。")
    private boolean noPureColor;

    @Option(names = {"--rotation"}, description = "啟用旋轉比對 (0/90/180/270 度)。")
    private boolean rotation;

    @Option(names = {"--enhanced"}, description = "啟用強化模式 (旋轉 + 縮放 + 特徵)。")
    private boolean enhanced;

    @Option(names = {"--confidence"}, defaultValue = "0.6", description = "強化模式最低信心度 (預設: 0.6)。")
    private double confidence;

    @Option(names = {"--hash-size"}, defaultValue = "8", description = "雜湊邊長 (預設: 8)。")
    private int hashSize;

    @Option(names = {"--threads"}, description = "雜湊計算的執行緒數 (預設: CPU 核心數)。")
    private Integer threads;

    @Option(names = {"--accelerated"}, description = "優先使用 OpenCV 原生函式庫計算雜湊。")
    private boolean accelerated;

    @Option(names = {"-o", "--output-dir"}, defaultValue = "results", description = "結果輸出目錄 (預設: results)。")
    private File outputDir;

    @Option(names = {"--cache-db"}, description = "H2 雜湊快取資料庫的檔案路徑，未指定時不使用快取。")
    private File h2DbFile;

    @Override
    public Integer call() throws Exception {
        DetectionConfig config = DetectionConfig.defaults()
                .withDhashThreshold(dhashThreshold)
                .withAhashThreshold(ahashThreshold)
                .withPhashThreshold(phashThreshold)
                .withDetectPureColor(!noPureColor)
                .withDetectRotation(rotation)
                .withEnhancedSimilarity(enhanced)
                .withConfidenceThreshold(confidence)
                .withHashSize(hashSize)
                .withPreferAccelerated(accelerated);
        if (threads != null) {
            config = config.withWorkerThreads(threads);
        }

        log.info("========================================查重程式參數設定========================================");
        log.info("圖片目錄: {} (遞迴: {})", directory.getAbsolutePath(), recursive);
        log.info("輸出目錄: {}", outputDir.getAbsolutePath());
        log.info("雜湊快取資料庫: {}", h2DbFile == null ? "未使用" : h2DbFile.getAbsolutePath());
        log.info("========================================查重程式參數設定========================================");

        List<String> images = FileTools.scanImages(directory.toPath(), recursive);
        if (images.isEmpty()) {
            log.warn("{} - 沒有找到任何圖片", directory);
        }

        DuplicateDetector detector = new DuplicateDetector();
        detector.setLogCallback(message -> log.debug("{}", message));
        detector.setProgressListener(event -> log.debug("進度 {}: {}/{} ({}%，預估剩餘 {}) {}", event.state(),
                event.completed(), event.total(), String.format("%.1f", event.percentage()),
                event.eta() == null ? "-" : event.eta().toSeconds() + " 秒", event.currentItem()));

        HashCacheManager cacheManager = null;
        Map<FileKey, CachedHashes> cache = new ConcurrentHashMap<>();
        if (h2DbFile != null) {
            cacheManager = new HashCacheManager(h2DbFile.toPath());
            cacheManager.initSchema();
            cache = cacheManager.loadAllToMap();
            detector.setHashCache(cache);
        }

        // 收到中斷訊號時要求偵測停止，並等部分結果與快取寫完才讓 JVM 結束
        CountDownLatch finished = new CountDownLatch(1);
        Thread stopHook = stopOnShutdown(detector, finished, SHUTDOWN_WAIT_SECONDS);
        Runtime.getRuntime().addShutdownHook(stopHook);
        try {
            DetectionResult result = detector.detectDuplicates(images, config);

            ResultWriter writer = new ResultWriter(outputDir.toPath());
            writer.writeCsv(result.groups(), null);
            writer.writeJson(result.groups(), null);
            writer.writeSummary(result.statistics(), null);

            if (cacheManager != null) {
                cacheManager.saveAllFromMap(cache);
            }
            log.info("偵測完成 ({})：{} 組重複，{} 張重複圖片", result.state(),
                    result.statistics().duplicateGroups(), result.statistics().duplicateImages());
            return 0;
        } catch (ProviderUnstableException e) {
            log.error("偵測中止: {}", e.getMessage(), e);
            return EXIT_FATAL;
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(stopHook);
            } catch (IllegalStateException e) {
                log.debug("JVM 正在關閉，無法移除停止掛鉤");
            }
            if (cacheManager != null) {
                cacheManager.close();
            }
            finished.countDown();
        }
    }

    static Thread stopOnShutdown(DuplicateDetector detector, CountDownLatch finished, long timeoutSeconds) {
        return new Thread(() -> {
            detector.stop();
            try {
                if (!finished.await(timeoutSeconds, TimeUnit.SECONDS)) {
                    log.warn("等待結果寫出逾時 ({} 秒)，部分結果可能未儲存", timeoutSeconds);
                }
            } catch (InterruptedException e) {
                log.warn("等待結果寫出時被中斷");
                Thread.currentThread().interrupt();
            }
        }, "duplicate-checker-stop");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Execute()).execute(args);
        System.exit(exitCode);
    }
}
