package work.pollochang.duplicate.image.cache;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * H2 雜湊快取管理器。
 * 負責與 H2 資料庫的底層互動，包括連線、資料表初始化、讀取與批次儲存。
 * 執行開始時整批載入到記憶體，結束時整批寫回。
 */
@Slf4j
public class HashCacheManager implements AutoCloseable {

    private static final String TABLE = "FILE_HASH_CACHE";

    // 使用 MERGE 陳述式實現 upsert
    private static final String MERGE_SQL = "MERGE INTO " + TABLE
            + " (PATH, FILE_SIZE, LAST_MODIFIED, FINGERPRINT, HASH_SIZE, PROVIDER, PURE_COLOR_THRESHOLD, DHASH, AHASH, PHASH)"
            + " KEY(PATH, FILE_SIZE, LAST_MODIFIED) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final int MAX_BATCH_SIZE = 1000;

    private final Connection connection;

    /**
     * @param dbPath H2 資料庫檔案的路徑 (可含或不含 .mv.db)
     */
    public HashCacheManager(Path dbPath) {
        // JDBC URL 不需要 .mv.db 副檔名
        String pathStr = dbPath.toAbsolutePath().toString().replace(".mv.db", "");
        // AUTO_SERVER=TRUE 允許多個進程安全地存取同一個資料庫
        String jdbcUrl = String.format("jdbc:h2:%s;AUTO_SERVER=TRUE", pathStr);
        try {
            this.connection = DriverManager.getConnection(jdbcUrl, "sa", "");
            log.info("成功連線至 H2 資料庫: {}", dbPath);
        } catch (SQLException e) {
            throw new IllegalStateException("無法建立 H2 資料庫連線: " + jdbcUrl, e);
        }
    }

    /**
     * 資料表不存在時建立。
     */
    public void initSchema() {
        String createTableSql = "CREATE TABLE IF NOT EXISTS " + TABLE + " (" +
                "PATH VARCHAR(4096) NOT NULL, " +
                "FILE_SIZE BIGINT NOT NULL, " +
                "LAST_MODIFIED BIGINT NOT NULL, " +
                "FINGERPRINT VARCHAR(32), " +
                "HASH_SIZE INT, " +
                "PROVIDER VARCHAR(32), " +
                "PURE_COLOR_THRESHOLD DOUBLE PRECISION, " +
                "DHASH VARCHAR(1024), " +
                "AHASH VARCHAR(1024), " +
                "PHASH VARCHAR(1024), " +
                "PRIMARY KEY (PATH, FILE_SIZE, LAST_MODIFIED)" +
                ")";
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
            // 舊版資料表沒有這兩個欄位，補上後舊紀錄的感知雜湊一律視為未命中
            stmt.execute("ALTER TABLE " + TABLE + " ADD COLUMN IF NOT EXISTS PROVIDER VARCHAR(32)");
            stmt.execute("ALTER TABLE " + TABLE + " ADD COLUMN IF NOT EXISTS PURE_COLOR_THRESHOLD DOUBLE PRECISION");
            log.info("H2 資料表 '{}' 已確認存在。", TABLE);
        } catch (SQLException e) {
            throw new IllegalStateException("無法初始化 H2 資料庫 Schema", e);
        }
    }

    /**
     * 讀取所有快取紀錄到記憶體。讀取失敗時回傳空的 map，偵測照常進行。
     */
    public Map<FileKey, CachedHashes> loadAllToMap() {
        Map<FileKey, CachedHashes> cache = new ConcurrentHashMap<>();
        String selectSql = "SELECT PATH, FILE_SIZE, LAST_MODIFIED, FINGERPRINT, HASH_SIZE, PROVIDER, PURE_COLOR_THRESHOLD, DHASH, AHASH, PHASH FROM " + TABLE;

        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(selectSql)) {
            while (rs.next()) {
                FileKey key = new FileKey(
                        rs.getString("PATH"),
                        rs.getLong("FILE_SIZE"),
                        rs.getLong("LAST_MODIFIED"));
                CachedHashes value = new CachedHashes(
                        rs.getString("FINGERPRINT"),
                        rs.getInt("HASH_SIZE"),
                        rs.getString("PROVIDER"),
                        rs.getDouble("PURE_COLOR_THRESHOLD"),
                        rs.getString("DHASH"),
                        rs.getString("AHASH"),
                        rs.getString("PHASH"));
                cache.put(key, value);
            }
        } catch (SQLException e) {
            log.error("從 H2 載入雜湊快取時發生錯誤", e);
        }
        log.info("從 H2 資料庫成功載入 {} 筆雜湊快取紀錄。", cache.size());
        return cache;
    }

    /**
     * 批次寫回記憶體快取，失敗時回滾整個交易。
     */
    public void saveAllFromMap(Map<FileKey, CachedHashes> cache) {
        if (cache == null || cache.isEmpty()) {
            log.info("記憶體快取為空，無需儲存至 H2。");
            return;
        }

        log.info("準備將 {} 筆快取紀錄批次寫入 H2 資料庫...", cache.size());
        int batchSize = 0;
        try (PreparedStatement ps = connection.prepareStatement(MERGE_SQL)) {
            connection.setAutoCommit(false);

            for (Map.Entry<FileKey, CachedHashes> entry : cache.entrySet()) {
                FileKey key = entry.getKey();
                CachedHashes value = entry.getValue();

                ps.setString(1, key.path());
                ps.setLong(2, key.size());
                ps.setLong(3, key.lastModified());
                setNullableString(ps, 4, value.fingerprint());
                ps.setInt(5, value.hashSize());
                setNullableString(ps, 6, value.provider());
                ps.setDouble(7, value.pureColorThreshold());
                setNullableString(ps, 8, value.difference());
                setNullableString(ps, 9, value.average());
                setNullableString(ps, 10, value.frequency());
                ps.addBatch();
                batchSize++;

                if (batchSize % MAX_BATCH_SIZE == 0) {
                    ps.executeBatch();
                    log.debug("已提交 {} 筆紀錄至 H2...", batchSize);
                }
            }
            if (batchSize % MAX_BATCH_SIZE != 0) {
                ps.executeBatch();
            }

            connection.commit();
            log.info("成功將 {} 筆紀錄儲存/更新至 H2 資料庫。", batchSize);
        } catch (SQLException e) {
            log.error("批次儲存快取至 H2 時發生錯誤", e);
            try {
                connection.rollback();
                log.warn("H2 交易已回滾。");
            } catch (SQLException ex) {
                log.error("回滾 H2 交易失敗", ex);
            }
        } finally {
            try {
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                log.error("無法恢復 H2 連線的自動提交模式", e);
            }
        }
    }

    private static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    @Override
    public void close() {
        try {
            log.info("正在關閉 H2 資料庫連線...");
            connection.close();
            log.info("H2 資料庫連線已關閉。");
        } catch (SQLException e) {
            log.error("關閉 H2 資料庫連線時發生錯誤。", e);
        }
    }
}
