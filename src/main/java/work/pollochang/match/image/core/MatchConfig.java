package work.pollochang.match.image.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.With;
import work.pollochang.match.image.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 樣板比對參數。每個欄位都有明確的預設值，JSON 設定檔可省略任何欄位。
 *
 * <pre>{@code
 * MatchConfig config = MatchConfig.defaults()
 *         .withConfidence(0.9)
 *         .withUseGrayscale(true);
 * }</pre>
 *
 * @param searchMultipleScales 是否使用多個縮放比例搜尋 (預設 true)；false 時只用 1.0
 * @param scaleSteps           樣板縮放比例清單 (預設 1.0 ~ 0.5)，每個值都必須大於 0
 * @param useGrayscale         是否先轉為灰階再比對 (預設 false)
 * @param confidence           最低信心分數，範圍 [0, 1] (預設 0.8)
 * @param limit                最多回傳幾筆結果 (預設 100)
 * @author PolloChang
 * @since 0.1.0
 */
@With
public record MatchConfig(
        boolean searchMultipleScales,
        List<Double> scaleSteps,
        boolean useGrayscale,
        double confidence,
        int limit
) {

    public static final boolean DEFAULT_SEARCH_MULTIPLE_SCALES = true;
    public static final List<Double> DEFAULT_SCALE_STEPS = List.of(1.0, 0.9, 0.8, 0.7, 0.6, 0.5);
    public static final boolean DEFAULT_USE_GRAYSCALE = false;
    public static final double DEFAULT_CONFIDENCE = 0.8;
    public static final int DEFAULT_LIMIT = 100;

    public MatchConfig {
        // 允許 null 元素，留給 validate() 回報
        scaleSteps = scaleSteps == null ? DEFAULT_SCALE_STEPS : Collections.unmodifiableList(new ArrayList<>(scaleSteps));
    }

    public static MatchConfig defaults() {
        return new MatchConfig(DEFAULT_SEARCH_MULTIPLE_SCALES, DEFAULT_SCALE_STEPS, DEFAULT_USE_GRAYSCALE,
                DEFAULT_CONFIDENCE, DEFAULT_LIMIT);
    }

    /**
     * 給 Jackson 使用，未出現的欄位套用預設值。
     */
    @JsonCreator
    public static MatchConfig fromJson(
            @JsonProperty("searchMultipleScales") Boolean searchMultipleScales,
            @JsonProperty("scaleSteps") List<Double> scaleSteps,
            @JsonProperty("useGrayscale") Boolean useGrayscale,
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("limit") Integer limit) {
        return new MatchConfig(
                searchMultipleScales != null ? searchMultipleScales : DEFAULT_SEARCH_MULTIPLE_SCALES,
                scaleSteps,
                useGrayscale != null ? useGrayscale : DEFAULT_USE_GRAYSCALE,
                confidence != null ? confidence : DEFAULT_CONFIDENCE,
                limit != null ? limit : DEFAULT_LIMIT);
    }

    /**
     * 實際參與搜尋的縮放比例。
     */
    public List<Double> effectiveScales() {
        return searchMultipleScales ? scaleSteps : List.of(1.0);
    }

    /**
     * 檢查所有欄位是否在允許範圍內。
     *
     * @throws ValidationException 任何欄位超出範圍
     */
    public void validate() {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new ValidationException("confidence 必須介於 0 與 1 之間: " + confidence);
        }
        if (limit < 1) {
            throw new ValidationException("limit 必須至少為 1: " + limit);
        }
        if (searchMultipleScales && scaleSteps.isEmpty()) {
            throw new ValidationException("啟用多尺度搜尋時 scaleSteps 不可為空");
        }
        for (Double step : scaleSteps) {
            if (step == null || step.isNaN() || step.isInfinite() || step <= 0.0) {
                throw new ValidationException("scaleSteps 的每個值都必須大於 0: " + scaleSteps);
            }
        }
    }
}
