package work.pollochang.match.image.core;

import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 產生不同比例的樣板副本。只縮放樣板，畫面本身永遠不縮放。
 *
 * <p>縮放尺寸為 {@code (ceil(w * s), ceil(h * s))}，以 OpenCV {@link Imgproc#INTER_LINEAR}
 * 內插，也就是像素中心對齊的雙線性公式：
 * <pre>
 *   sx = (dx + 0.5) * srcW / dstW - 0.5   (限制在 [0, srcW - 1])
 *   x0 = floor(sx), x1 = min(x0 + 1, srcW - 1), fx = sx - x0
 *   v  = lerp(lerp(p(x0,y0), p(x1,y0), fx), lerp(p(x0,y1), p(x1,y1), fx), fy)
 * </pre>
 * 比例 1.0 時結果與原圖完全相同。比例大於 1.0 時同樣適用，只是樣板會放大。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public final class ScalePyramid {

    // 避免 40 * 0.7 = 28.000000000000004 被 ceil 成 29
    private static final double SIZE_EPSILON = 1e-9;

    private ScalePyramid() {}

    /**
     * 依設定產生所有可用的縮放樣板。
     * 縮放後任一邊超過搜尋範圍的比例會直接略過，不視為錯誤。
     *
     * @param template  正規化後的原始樣板
     * @param config    比對參數
     * @param maxWidth  搜尋範圍寬度
     * @param maxHeight 搜尋範圍高度
     * @return 依設定順序排列的縮放樣板，可能為空
     */
    public static List<ScaledTemplate> build(SampleImage template, MatchConfig config, int maxWidth, int maxHeight) {
        List<ScaledTemplate> pyramid = new ArrayList<>();
        for (double scale : new LinkedHashSet<>(config.effectiveScales())) {
            int width = scaledLength(template.width(), scale);
            int height = scaledLength(template.height(), scale);
            if (width > maxWidth || height > maxHeight) {
                log.debug("略過比例 {}: 樣板 {}x{} 大於搜尋範圍 {}x{}", scale, width, height, maxWidth, maxHeight);
                continue;
            }
            pyramid.add(resize(template, scale, width, height));
        }
        return pyramid;
    }

    public static int scaledLength(int length, double scale) {
        return Math.max(1, (int) Math.ceil(length * scale - SIZE_EPSILON));
    }

    public static ScaledTemplate resize(SampleImage source, double scale) {
        return resize(source, scale, scaledLength(source.width(), scale), scaledLength(source.height(), scale));
    }

    static ScaledTemplate resize(SampleImage source, double scale, int width, int height) {
        Mat src = OpenCvSupport.toMat(source);
        Mat dst = new Mat();
        try {
            Imgproc.resize(src, dst, new Size(width, height), 0, 0, Imgproc.INTER_LINEAR);
            return new ScaledTemplate(scale, width, height, source.layout(), OpenCvSupport.toPlanes(dst));
        } finally {
            src.release();
            dst.release();
        }
    }
}
