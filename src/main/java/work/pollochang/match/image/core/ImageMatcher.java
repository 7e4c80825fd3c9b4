package work.pollochang.match.image.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.match.image.exception.ValidationException;
import work.pollochang.match.image.report.MatchResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 在一張已擷取的畫面中尋找樣板，整個流程為同步運算：
 * <ol>
 *   <li>驗證參數與搜尋區域。</li>
 *   <li>裁切畫面至搜尋區域，樣板與畫面轉成相同的樣本排列。</li>
 *   <li>依設定比例產生縮放樣板，過大的比例直接略過。</li>
 *   <li>每個比例計算 NCC，收集達到門檻的位置。</li>
 *   <li>去除重複、排序、截斷，最後把座標加回區域原點。</li>
 * </ol>
 * 每次呼叫所需的暫存資料都只存在於該次呼叫內，可安全地同時被多個執行緒呼叫。
 *
 * <p>使用範例：
 * <pre>{@code
 * ImageResource screen = ImageResources.imageResourceSync(Path.of("screen.png"));
 * ImageResource button = ImageResources.imageResourceSync(Path.of("button.png"));
 * Optional<MatchResult> hit = ImageMatcher.find(screen, button, MatchConfig.defaults());
 * }</pre>
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public final class ImageMatcher {

    private ImageMatcher() {}

    /**
     * 在整張畫面中找出信心分數最高的一筆結果。
     */
    public static Optional<MatchResult> find(ImageResource haystack, ImageResource template, MatchConfig config) {
        return findInRegion(haystack, template, Region.of(haystack), config);
    }

    /**
     * 在整張畫面中找出所有結果，依信心分數由高到低排列。
     */
    public static List<MatchResult> findAll(ImageResource haystack, ImageResource template, MatchConfig config) {
        return findAllInRegion(haystack, template, Region.of(haystack), config);
    }

    /**
     * 只在 {@code region} 內搜尋，回傳信心分數最高的一筆。找不到時回傳空值，不視為錯誤。
     */
    public static Optional<MatchResult> findInRegion(ImageResource haystack, ImageResource template,
                                                     Region region, MatchConfig config) {
        MatchConfig effective = config == null ? MatchConfig.defaults() : config;
        effective.validate();
        // 只需要第一名，去除重複時可以提早結束
        List<MatchResult> results = findAllInRegion(haystack, template, region, effective.withLimit(1));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * 只在 {@code region} 內搜尋所有結果。回傳座標為整張畫面的絕對座標。
     *
     * @param haystack 已擷取的整張畫面
     * @param template 樣板
     * @param region   搜尋區域，必須完全落在畫面內
     * @param config   比對參數，{@code null} 時使用預設值
     * @return 依信心分數由高到低排列、最多 {@code config.limit()} 筆的結果
     * @throws ValidationException 參數超出範圍或區域超出畫面
     */
    public static List<MatchResult> findAllInRegion(ImageResource haystack, ImageResource template,
                                                    Region region, MatchConfig config) {
        Objects.requireNonNull(haystack, "haystack must not be null");
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(region, "region must not be null");
        MatchConfig effective = config == null ? MatchConfig.defaults() : config;
        effective.validate();
        region.validateWithin(haystack.width(), haystack.height());

        long start = System.nanoTime();
        SampleLayout layout = ImageNormalizer.chooseLayout(template, haystack, effective.useGrayscale());
        SampleImage area = ImageNormalizer.normalize(haystack, region, layout);
        SampleImage base = ImageNormalizer.normalize(template, layout);

        List<ScaledTemplate> pyramid = ScalePyramid.build(base, effective, area.width(), area.height());
        if (pyramid.isEmpty()) {
            log.debug("樣板 {} 在所有比例下都大於搜尋區域 {}，沒有可比對的比例", template, region);
            return List.of();
        }

        List<Candidate> candidates = new ArrayList<>();
        try (SearchArea searchArea = SearchArea.of(area)) {
            for (ScaledTemplate scaled : pyramid) {
                candidates.addAll(CorrelationMatcher.match(searchArea, scaled, effective.confidence()));
            }
        }
        List<Candidate> kept = CandidateAggregator.aggregate(candidates, effective.limit());

        List<MatchResult> results = new ArrayList<>(kept.size());
        for (Candidate c : kept) {
            results.add(new MatchResult(c.x() + region.x(), c.y() + region.y(),
                    c.width(), c.height(), c.confidence(), c.scale()));
        }
        log.debug("在 {} 的區域 {} 中搜尋 {}: {} 個比例，{} 筆結果，耗時 {} ms",
                haystack, region, template, pyramid.size(), results.size(),
                (System.nanoTime() - start) / 1_000_000);
        return results;
    }
}
