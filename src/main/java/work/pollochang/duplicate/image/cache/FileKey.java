package work.pollochang.duplicate.image.cache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * 快取鍵：路徑、大小、最後修改時間任一改變就視為不同的檔案。
 */
public record FileKey(String path, long size, long lastModified) {

    public static FileKey of(Path path) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
        return new FileKey(path.toAbsolutePath().normalize().toString(), attributes.size(),
                attributes.lastModifiedTime().toMillis());
    }
}
