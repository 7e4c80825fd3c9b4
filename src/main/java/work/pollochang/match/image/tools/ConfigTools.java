package work.pollochang.match.image.tools;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.match.image.core.MatchConfig;
import work.pollochang.match.image.exception.ValidationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 以 JSON 讀寫比對參數。
 */
@Slf4j
public class ConfigTools {

    /**
     * 從 JSON 檔案讀取比對參數，未出現的欄位使用預設值。
     *
     * <pre>{@code
     * { "confidence": 0.9, "scaleSteps": [1.0, 0.75, 0.5], "useGrayscale": true }
     * }</pre>
     *
     * @param path 設定檔路徑
     * @return 已通過驗證的比對參數
     * @throws ValidationException 檔案不存在、格式錯誤或欄位超出範圍
     */
    public static MatchConfig loadMatchConfig(Path path) {
        if (!Files.isReadable(path)) {
            throw new ValidationException("設定檔不存在或不可讀: " + path);
        }
        try {
            MatchConfig config = newMapper().readValue(path.toFile(), MatchConfig.class);
            config.validate();
            log.info("成功從 {} 讀取比對參數: {}", path, config);
            return config;
        } catch (IOException e) {
            throw new ValidationException("無法解析設定檔: " + path, e);
        }
    }

    /**
     * 將比對參數寫成格式化的 JSON，方便作為設定檔範本。
     */
    public static void saveMatchConfig(Path path, MatchConfig config) throws IOException {
        FileTools.ensureParentExists(path);
        newMapper().writeValue(path.toFile(), config);
        log.info("比對參數已儲存至 {}", path);
    }

    public static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT); // 讓 JSON 格式化，方便閱讀
        mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
