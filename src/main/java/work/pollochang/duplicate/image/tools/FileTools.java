package work.pollochang.duplicate.image.tools;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

@Slf4j
public class FileTools {

    /** 視為圖片的副檔名 (小寫) */
    public static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "bmp", "gif", "webp");

    private FileTools() {}

    /**
     * 列出目錄中的圖片，依絕對路徑排序。
     * @param directory 要掃描的目錄
     * @param recursive 是否包含子目錄
     */
    public static List<String> scanImages(Path directory, boolean recursive) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("不是目錄: " + directory);
        }
        int depth = recursive ? Integer.MAX_VALUE : 1;
        try (Stream<Path> files = Files.walk(directory, depth)) {
            List<String> images = files
                    .filter(Files::isRegularFile)
                    .filter(FileTools::isImage)
                    .map(p -> p.toAbsolutePath().normalize().toString())
                    .distinct()
                    .sorted()
                    .toList();
            log.info("{} - 找到 {} 個圖片檔案 (遞迴: {})", directory, images.size(), recursive);
            return images;
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public static boolean isImage(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    /**
     * 確保指定的目錄存在，如果不存在則建立它。
     * @param directoryPath 要檢查或建立的目錄路徑
     */
    public static void ensureDirectoryExists(Path directoryPath) {
        if (!Files.exists(directoryPath)) {
            try {
                Files.createDirectories(directoryPath);
                log.info("{} - 目標目錄已建立", directoryPath);
            } catch (IOException e) {
                // 拋出例外使上層能夠捕獲並中止程式
                throw new UncheckedIOException("無法建立目錄: " + directoryPath, e);
            }
        } else {
            log.debug("{} - 目標目錄已存在", directoryPath);
        }
    }

    public static String formatFileSize(long size) {
        if (size <= 0) return "0 B";
        final String[] units = new String[]{"B", "KB", "MB", "GB", "TB"};
        int digitGroups = (int) (Math.log10(size) / Math.log10(1024));
        return new DecimalFormat("#,##0.#").format(size / Math.pow(1024, digitGroups)) + " " + units[digitGroups];
    }
}
