package work.pollochang.match.image;

import work.pollochang.match.image.core.ImageResource;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Random;

/**
 * 測試用的合成影像。
 */
public final class ImageFixtures {

    private ImageFixtures() {}

    public static ImageResource solid(int width, int height, int r, int g, int b) {
        byte[] buffer = new byte[width * height * 3];
        for (int i = 0; i < buffer.length; i += 3) {
            buffer[i] = (byte) r;
            buffer[i + 1] = (byte) g;
            buffer[i + 2] = (byte) b;
        }
        return new ImageResource(buffer, width, height, 3, null);
    }

    /**
     * 每個像素獨立亂數的 RGB 影像。
     */
    public static ImageResource noise(int width, int height, long seed) {
        return noise(width, height, 3, seed);
    }

    public static ImageResource noise(int width, int height, int channels, long seed) {
        byte[] buffer = new byte[width * height * channels];
        new Random(seed).nextBytes(buffer);
        return new ImageResource(buffer, width, height, channels, null);
    }

    /**
     * 把 {@code template} 直接覆蓋到 {@code canvas} 的 (x, y)，兩者通道數必須相同。
     */
    public static void stamp(ImageResource canvas, ImageResource template, int x, int y) {
        int channels = canvas.channels();
        if (template.channels() != channels) {
            throw new IllegalArgumentException("通道數不同");
        }
        for (int row = 0; row < template.height(); row++) {
            System.arraycopy(template.buffer(), row * template.width() * channels,
                    canvas.buffer(), ((y + row) * canvas.width() + x) * channels,
                    template.width() * channels);
        }
    }

    /**
     * 複製 {@code image} 中的一塊區域。
     */
    public static ImageResource crop(ImageResource image, int x, int y, int width, int height) {
        int channels = image.channels();
        byte[] buffer = new byte[width * height * channels];
        for (int row = 0; row < height; row++) {
            System.arraycopy(image.buffer(), ((y + row) * image.width() + x) * channels,
                    buffer, row * width * channels, width * channels);
        }
        return new ImageResource(buffer, width, height, channels, null);
    }

    public static ImageResource copy(ImageResource image) {
        return new ImageResource(image.buffer().clone(), image.width(), image.height(), image.channels(), null);
    }

    /**
     * 寫成 PNG 檔 (RGB 影像)。
     */
    public static Path writePng(Path path, ImageResource image) throws IOException {
        BufferedImage out = new BufferedImage(image.width(), image.height(), BufferedImage.TYPE_INT_RGB);
        byte[] buffer = image.buffer();
        for (int y = 0; y < image.height(); y++) {
            for (int x = 0; x < image.width(); x++) {
                int i = (y * image.width() + x) * 3;
                int rgb = (buffer[i] & 0xFF) << 16 | (buffer[i + 1] & 0xFF) << 8 | (buffer[i + 2] & 0xFF);
                out.setRGB(x, y, rgb);
            }
        }
        ImageIO.write(out, "png", path.toFile());
        return path;
    }
}
