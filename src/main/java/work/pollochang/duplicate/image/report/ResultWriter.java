package work.pollochang.duplicate.image.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.duplicate.image.model.DuplicateGroup;
import work.pollochang.duplicate.image.model.GroupMember;
import work.pollochang.duplicate.image.model.ReasonTag;
import work.pollochang.duplicate.image.model.RunStatistics;
import work.pollochang.duplicate.image.tools.FileTools;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 將偵測結果寫成 CSV、JSON 與文字摘要。
 * 未指定檔名時以 {@code duplicates_yyyyMMdd_HHmmss} 命名。
 */
@Slf4j
public class ResultWriter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String SEPARATOR = "=".repeat(50);

    private final Path outputDir;
    private final Clock clock;
    private final ObjectMapper jsonMapper;
    private final CsvMapper csvMapper;

    public ResultWriter(Path outputDir) {
        this(outputDir, Clock.systemDefaultZone());
    }

    public ResultWriter(Path outputDir, Clock clock) {
        this.outputDir = outputDir;
        this.clock = clock;
        this.jsonMapper = new ObjectMapper();
        this.jsonMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.jsonMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.csvMapper = new CsvMapper();
        FileTools.ensureDirectoryExists(outputDir);
    }

    @JsonPropertyOrder({"group_id", "duplicate_reason", "file_path", "difference_distance", "average_distance",
            "frequency_distance", "rotation_angle", "detection_type", "confidence"})
    record CsvRow(@JsonProperty("group_id") int groupId,
                  @JsonProperty("duplicate_reason") String reason,
                  @JsonProperty("file_path") String filePath,
                  @JsonProperty("difference_distance") Integer differenceDistance,
                  @JsonProperty("average_distance") Integer averageDistance,
                  @JsonProperty("frequency_distance") Integer frequencyDistance,
                  @JsonProperty("rotation_angle") Integer rotationAngle,
                  @JsonProperty("detection_type") String detectionType,
                  @JsonProperty("confidence") Double confidence) {

        static CsvRow of(int groupId, String reason, GroupMember m) {
            return new CsvRow(groupId, reason, m.path(),
                    m.distances() == null ? null : m.distances().difference(),
                    m.distances() == null ? null : m.distances().average(),
                    m.distances() == null ? null : m.distances().frequency(),
                    m.rotationAngle(), m.detectionType(), m.confidence());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"group_id", "reason", "reason_tags", "confidence", "files", "members"})
    record JsonGroup(@JsonProperty("group_id") int groupId,
                     @JsonProperty("reason") String reason,
                     @JsonProperty("reason_tags") List<ReasonTag> reasonTags,
                     @JsonProperty("confidence") Double confidence,
                     @JsonProperty("files") List<String> files,
                     @JsonProperty("members") List<GroupMember> members) {
    }

    public Path writeCsv(List<DuplicateGroup> groups, String fileName) throws IOException {
        Path target = outputDir.resolve(fileName != null ? fileName : "duplicates_" + timestamp() + ".csv");
        List<CsvRow> rows = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) {
            DuplicateGroup group = groups.get(i);
            for (GroupMember member : group.members()) {
                rows.add(CsvRow.of(i + 1, group.reason(), member));
            }
        }
        CsvSchema schema = csvMapper.schemaFor(CsvRow.class).withHeader();
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            csvMapper.writer(schema).writeValue(writer, rows);
        }
        log.info("已寫入 CSV 結果: {} ({} 組，{})", target, groups.size(), FileTools.formatFileSize(Files.size(target)));
        return target;
    }

    public Path writeJson(List<DuplicateGroup> groups, String fileName) throws IOException {
        Path target = outputDir.resolve(fileName != null ? fileName : "duplicates_" + timestamp() + ".json");
        List<JsonGroup> result = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            DuplicateGroup g = groups.get(i);
            result.add(new JsonGroup(i + 1, g.reason(), List.copyOf(g.reasonTags()), g.confidence(), g.paths(), g.members()));
        }
        jsonMapper.writeValue(target.toFile(), result);
        log.info("已寫入 JSON 結果: {} ({})", target, FileTools.formatFileSize(Files.size(target)));
        return target;
    }

    public Path writeSummary(RunStatistics stats, String fileName) throws IOException {
        Path target = outputDir.resolve(fileName != null ? fileName : "summary_" + timestamp() + ".txt");
        StringBuilder sb = new StringBuilder();
        sb.append("圖片查重統計摘要 - ")
                .append(LocalDateTime.now(clock).format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")))
                .append('\n');
        sb.append(SEPARATOR).append("\n\n");
        sb.append("總處理圖片數: ").append(stats.totalImages()).append('\n');
        sb.append("重複圖片組數: ").append(stats.duplicateGroups()).append('\n');
        sb.append("重複圖片總數: ").append(stats.duplicateImages()).append('\n');
        if (stats.pureColorImages() > 0) {
            sb.append("純色圖片數: ").append(stats.pureColorImages()).append('\n');
        }
        if (stats.failedFiles() > 0) {
            sb.append("無法讀取的檔案數: ").append(stats.failedFiles()).append('\n');
        }
        sb.append('\n').append("按重複原因統計:\n");
        for (Map.Entry<String, Integer> entry : stats.reasonHistogram().entrySet()) {
            sb.append("  - ").append(entry.getKey()).append(": ").append(entry.getValue()).append("組\n");
        }
        sb.append('\n').append(SEPARATOR).append('\n');
        Files.writeString(target, sb.toString(), StandardCharsets.UTF_8);
        log.info("已寫入統計摘要: {}", target);
        return target;
    }

    private String timestamp() {
        return LocalDateTime.now(clock).format(TIMESTAMP);
    }
}
