package work.pollochang.match.image.tools;

import work.pollochang.match.image.core.ImageResource;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.nio.file.Path;

public class ImageTools {

    /**
     * 將 {@link BufferedImage} 轉成交錯排列的位元組。
     * <ul>
     *   <li>灰階影像直接讀取 raster 樣本，輸出 1 通道 (帶 alpha 時 2 通道)。</li>
     *   <li>其他影像輸出 RGB 3 通道 (帶 alpha 時 RGBA 4 通道)。</li>
     * </ul>
     * 灰階不可經過 {@code getRGB}，否則會被轉換到 sRGB 而改變灰階值。
     *
     * @param image 來源影像
     * @param path  來源檔案，可為 null
     */
    public static ImageResource toImageResource(BufferedImage image, Path path) {
        if (isGray(image)) {
            return grayResource(image, path);
        }
        int width = image.getWidth();
        int height = image.getHeight();
        boolean alpha = image.getColorModel().hasAlpha();
        int channels = alpha ? 4 : 3;
        byte[] buffer = new byte[width * height * channels];
        int[] row = new int[width];
        int i = 0;
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int argb = row[x];
                buffer[i++] = (byte) (argb >> 16);
                buffer[i++] = (byte) (argb >> 8);
                buffer[i++] = (byte) argb;
                if (alpha) {
                    buffer[i++] = (byte) (argb >>> 24);
                }
            }
        }
        return new ImageResource(buffer, width, height, channels, path);
    }

    private static boolean isGray(BufferedImage image) {
        ColorModel model = image.getColorModel();
        int bands = image.getRaster().getNumBands();
        return !(model instanceof IndexColorModel)
                && model.getColorSpace().getType() == ColorSpace.TYPE_GRAY
                && bands == (model.hasAlpha() ? 2 : 1);
    }

    private static ImageResource grayResource(BufferedImage image, Path path) {
        int width = image.getWidth();
        int height = image.getHeight();
        Raster raster = image.getRaster();
        int channels = raster.getNumBands();
        int[] bits = raster.getSampleModel().getSampleSize();
        byte[] buffer = new byte[width * height * channels];
        int[] row = new int[width];
        for (int band = 0; band < channels; band++) {
            for (int y = 0; y < height; y++) {
                raster.getSamples(0, y, width, 1, band, row);
                int i = y * width * channels + band;
                for (int x = 0; x < width; x++, i += channels) {
                    buffer[i] = (byte) toEightBits(row[x], bits[band]);
                }
            }
        }
        return new ImageResource(buffer, width, height, channels, path);
    }

    private static int toEightBits(int sample, int bits) {
        if (bits == 8) {
            return sample;
        }
        if (bits > 8) {
            return sample >>> (bits - 8);
        }
        return sample * 255 / ((1 << bits) - 1);
    }
}
