package work.pollochang.match.image.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.match.image.exception.DecodeException;
import work.pollochang.match.image.tools.ImageTools;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * 建立 {@link ImageResource} 的方法：從檔案解碼、從記憶體中的編碼資料解碼，或直接包裝原始像素。
 */
@Slf4j
public final class ImageResources {

    static {
        ImageIO.setUseCache(false);
    }

    private ImageResources() {}

    /**
     * 在背景執行緒讀取並解碼影像檔。
     */
    public static CompletableFuture<ImageResource> imageResource(Path path) {
        return imageResource(path, ForkJoinPool.commonPool());
    }

    public static CompletableFuture<ImageResource> imageResource(Path path, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return imageResourceSync(path);
            } catch (IOException e) {
                throw new UncheckedIOException("讀取影像檔失敗: " + path, e);
            }
        }, executor);
    }

    /**
     * 讀取並解碼影像檔 (PNG、JPEG、BMP、GIF 等 ImageIO 支援的格式)。
     *
     * @param path 影像檔路徑
     * @return 帶有 alpha 時為 RGBA，否則為 RGB
     * @throws IOException     檔案無法讀取
     * @throws DecodeException 檔案內容不是可辨識的影像
     */
    public static ImageResource imageResourceSync(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            BufferedImage image = ImageIO.read(in);
            if (image == null) {
                throw new DecodeException("找不到對應的圖片讀取器: " + path);
            }
            log.debug("{} - 已解碼 {}x{}", path, image.getWidth(), image.getHeight());
            return ImageTools.toImageResource(image, path);
        }
    }

    /**
     * 解碼記憶體中的影像檔內容。
     *
     * @throws DecodeException 內容無法解碼
     */
    public static ImageResource imageResourceFromEncoded(byte[] encoded) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(encoded));
            if (image == null) {
                throw new DecodeException("無法辨識的影像格式 (" + encoded.length + " bytes)");
            }
            return ImageTools.toImageResource(image, null);
        } catch (IOException e) {
            throw new DecodeException("影像資料解碼失敗", e);
        }
    }

    /**
     * 直接包裝原始像素，不複製：{@code imageResourceFromBuffer(buf, ...).buffer() == buf}。
     *
     * @throws DecodeException 緩衝區長度與尺寸不符
     */
    public static ImageResource imageResourceFromBuffer(byte[] buffer, int width, int height, int channels) {
        return new ImageResource(buffer, width, height, channels, null);
    }
}
