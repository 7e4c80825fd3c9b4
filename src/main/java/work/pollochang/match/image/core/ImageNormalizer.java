package work.pollochang.match.image.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.match.image.exception.DecodeException;

/**
 * 將 {@link ImageResource} 轉成比對用的樣本平面。
 * <p>
 * alpha 通道一律捨棄，不作為比對依據。灰階轉換使用
 * {@code L = 0.299R + 0.587G + 0.114B}，以整數 {@code 299R + 587G + 114B} 保存以避免誤差。
 */
@Slf4j
public final class ImageNormalizer {

    private ImageNormalizer() {}

    /**
     * 決定樣板與畫面共用的排列方式。
     * 要求灰階，或兩者之一本身只有灰階資訊時，都改用亮度比對。
     */
    public static SampleLayout chooseLayout(ImageResource template, ImageResource haystack, boolean useGrayscale) {
        if (useGrayscale || template.colorChannels() != haystack.colorChannels()) {
            return SampleLayout.LUMINANCE;
        }
        return template.colorChannels() == 3 ? SampleLayout.RGB : SampleLayout.LUMINANCE;
    }

    public static SampleImage normalize(ImageResource image, SampleLayout layout) {
        return normalize(image, Region.of(image), layout);
    }

    /**
     * 只讀取 {@code region} 範圍內的像素並轉成樣本平面。
     *
     * @param image  來源影像
     * @param region 要讀取的範圍，呼叫端須先確認其落在影像內
     * @param layout 輸出排列方式
     * @return 尺寸等於 region 的樣本
     * @throws DecodeException 緩衝區長度與宣告尺寸不符
     */
    public static SampleImage normalize(ImageResource image, Region region, SampleLayout layout) {
        byte[] buffer = image.buffer();
        int channels = image.channels();
        if (buffer.length != (long) image.width() * image.height() * channels) {
            throw new DecodeException("像素緩衝區長度與影像尺寸不符: " + image);
        }

        int width = region.width();
        int height = region.height();
        int[][] planes = new int[layout.planes()][width * height];
        boolean color = channels >= 3;

        for (int y = 0; y < height; y++) {
            int src = ((region.y() + y) * image.width() + region.x()) * channels;
            int dst = y * width;
            for (int x = 0; x < width; x++, src += channels, dst++) {
                if (color) {
                    int r = buffer[src] & 0xFF;
                    int g = buffer[src + 1] & 0xFF;
                    int b = buffer[src + 2] & 0xFF;
                    if (layout == SampleLayout.RGB) {
                        planes[0][dst] = r;
                        planes[1][dst] = g;
                        planes[2][dst] = b;
                    } else {
                        planes[0][dst] = luminance(r, g, b);
                    }
                } else {
                    int v = buffer[src] & 0xFF;
                    if (layout == SampleLayout.RGB) {
                        planes[0][dst] = v;
                        planes[1][dst] = v;
                        planes[2][dst] = v;
                    } else {
                        planes[0][dst] = v * SampleLayout.LUMINANCE.unit();
                    }
                }
            }
        }
        log.trace("正規化 {} 區域 {} -> {}{}", image, region, layout, image.hasAlpha() ? " (捨棄 alpha)" : "");
        return new SampleImage(width, height, layout, planes);
    }

    /**
     * 亮度乘以 1000 後的整數值。
     */
    public static int luminance(int r, int g, int b) {
        return 299 * r + 587 * g + 114 * b;
    }
}
