package work.pollochang.match.image.core;

import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 正規化互相關 (NCC) 比對器，計算縮放樣板在畫面上每個合法左上角位置的信心分數。
 *
 * <p>對位置 {@code (x, y)}，{@code 0 <= x <= W - w}、{@code 0 <= y <= H - h}：
 * <pre>
 *   NCC = Σ[(H_ij - H̄)(T_ij - T̄)] / sqrt(Σ(H_ij - H̄)² · Σ(T_ij - T̄)²)
 * </pre>
 * 多通道時每個通道各自扣除平均，分子與兩個平方和再跨通道加總，也就是 OpenCV
 * {@link Imgproc#TM_CCOEFF_NORMED} 的定義。結果限制在 [0, 1]，負相關視為 0。
 *
 * <p>變異數為 0 (單色) 的情況 OpenCV 沒有定義，另外處理：
 * <ul>
 *   <li>樣板與視窗都是單色：每個通道平均值相差不到半個灰階時為 1，否則為 0。</li>
 *   <li>只有其中一方是單色：0。</li>
 * </ul>
 * 視窗是否單色由整數積分圖判斷 (精確值)，不受浮點數捨入影響。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public final class CorrelationMatcher {

    // 樣板變異數相對於能量小於此值即視為單色 (雙線性內插會留下極小的捨入誤差)
    private static final double FLAT_EPSILON = 1e-12;
    private static final double HALF_LEVEL = 0.5;

    private CorrelationMatcher() {}

    /**
     * 找出信心分數不低於 {@code threshold} 的所有位置。
     *
     * @param haystack  搜尋範圍內的畫面樣本
     * @param template  縮放後的樣板，尺寸不可超過畫面
     * @param threshold 最低信心分數
     * @return 依位置 (row-major) 排列的候選結果，座標相對於 haystack
     */
    public static List<Candidate> match(SampleImage haystack, ScaledTemplate template, double threshold) {
        try (SearchArea area = SearchArea.of(haystack)) {
            return match(area, template, threshold);
        }
    }

    static List<Candidate> match(SearchArea area, ScaledTemplate template, double threshold) {
        double[] scores = scores(area, template);
        int outW = area.samples().width() - template.width() + 1;
        List<Candidate> candidates = new ArrayList<>();
        for (int p = 0; p < scores.length; p++) {
            if (scores[p] >= threshold) {
                candidates.add(new Candidate(p % outW, p / outW, template.width(), template.height(),
                        scores[p], template.scale()));
            }
        }
        log.debug("比例 {} ({}x{}): {} 個位置中有 {} 個達到門檻 {}",
                template.scale(), template.width(), template.height(), scores.length, candidates.size(), threshold);
        return candidates;
    }

    /**
     * 每個合法位置的信心分數，索引為 {@code y * (W - w + 1) + x}。
     */
    public static double[] scores(SampleImage haystack, ScaledTemplate template) {
        try (SearchArea area = SearchArea.of(haystack)) {
            return scores(area, template);
        }
    }

    static double[] scores(SearchArea area, ScaledTemplate template) {
        SampleImage haystack = area.samples();
        int width = haystack.width();
        int height = haystack.height();
        int tw = template.width();
        int th = template.height();
        if (tw > width || th > height) {
            throw new IllegalArgumentException("樣板 " + tw + "x" + th + " 大於畫面 " + width + "x" + height);
        }
        if (haystack.layout() != template.layout()) {
            throw new IllegalArgumentException("樣板與畫面的樣本排列不同: " + template.layout() + " / " + haystack.layout());
        }
        int outW = width - tw + 1;
        int outH = height - th + 1;
        int outN = outW * outH;
        int planes = haystack.layout().planes();
        long n = (long) tw * th;

        // 樣板統計量
        double[] templateMeans = new double[planes];
        double templateVariance = 0.0;
        double templateEnergy = 0.0;
        for (int c = 0; c < planes; c++) {
            double[] values = template.planes()[c];
            double sum = 0.0;
            for (double v : values) {
                sum += v;
            }
            double mean = sum / n;
            templateMeans[c] = mean;
            for (double v : values) {
                templateVariance += (v - mean) * (v - mean);
                templateEnergy += v * v;
            }
        }
        boolean templateFlat = templateVariance <= FLAT_EPSILON * templateEnergy;

        // 視窗統計量
        boolean[] windowFlat = new boolean[outN];
        boolean[] sameLevel = new boolean[outN];
        Arrays.fill(windowFlat, true);
        Arrays.fill(sameLevel, true);
        double tolerance = HALF_LEVEL * haystack.layout().unit();
        for (int c = 0; c < planes; c++) {
            for (int y = 0; y < outH; y++) {
                for (int x = 0; x < outW; x++) {
                    long s = area.windowSum(c, x, y, tw, th);
                    int p = y * outW + x;
                    if (centeredSumOfSquares(n, s, area.windowSquares(c, x, y, tw, th)) > 0.0) {
                        windowFlat[p] = false;
                    }
                    if (templateFlat && Math.abs((double) s / n - templateMeans[c]) > tolerance) {
                        sameLevel[p] = false;
                    }
                }
            }
        }

        double[] correlation = templateFlat ? null : normalizedCorrelation(area.mat(), template);

        double[] scores = new double[outN];
        for (int p = 0; p < outN; p++) {
            if (templateFlat || windowFlat[p]) {
                scores[p] = (templateFlat && windowFlat[p] && sameLevel[p]) ? 1.0 : 0.0;
            } else {
                scores[p] = Math.max(0.0, Math.min(1.0, correlation[p]));
            }
        }
        return scores;
    }

    private static double[] normalizedCorrelation(Mat image, ScaledTemplate template) {
        Mat templ = OpenCvSupport.toMat(template.width(), template.height(), template.planes());
        Mat result = new Mat();
        try {
            Imgproc.matchTemplate(image, templ, result, Imgproc.TM_CCOEFF_NORMED);
            return OpenCvSupport.values(result);
        } finally {
            templ.release();
            result.release();
        }
    }

    /**
     * {@code Σ(v - mean)² = (n·q - s²) / n}，以 128 位元整數計算分子，結果恆不為負，
     * 且只有在所有樣本相同時才是 0。
     */
    static double centeredSumOfSquares(long n, long s, long q) {
        long hi1 = Math.multiplyHigh(n, q);
        long lo1 = n * q;
        long hi2 = Math.multiplyHigh(s, s);
        long lo2 = s * s;
        long lo = lo1 - lo2;
        long hi = hi1 - hi2 - (Long.compareUnsigned(lo1, lo2) < 0 ? 1 : 0);
        if (hi == 0 && lo == 0) {
            return 0.0;
        }
        double unsignedLo = (double) (lo >>> 1) * 2.0 + (lo & 1L);
        return (hi * 0x1p64 + unsignedLo) / n;
    }
}
