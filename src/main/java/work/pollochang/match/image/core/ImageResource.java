package work.pollochang.match.image.core;

import work.pollochang.match.image.exception.DecodeException;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 已解碼的影像資料，像素以交錯 (interleaved) 方式存放，每個樣本一個位元組。
 * <p>
 * 建立後視為不可變，可在多個同時進行的搜尋之間共用而不需加鎖；
 * {@link #buffer()} 回傳的陣列即為建立時傳入的陣列，呼叫端不應再修改其內容。
 *
 * @param buffer   像素資料，長度必須為 {@code width * height * channels}
 * @param width    寬度 (px)
 * @param height   高度 (px)
 * @param channels 通道數：1 (灰階)、2 (灰階 + alpha)、3 (RGB)、4 (RGBA)
 * @param path     來源檔案路徑，記憶體中的資料為 {@code null}
 */
public record ImageResource(byte[] buffer, int width, int height, int channels, Path path) {

    public ImageResource {
        if (buffer == null) {
            throw new DecodeException("像素緩衝區不可為 null");
        }
        if (width <= 0 || height <= 0) {
            throw new DecodeException("影像尺寸無效: " + width + "x" + height);
        }
        if (channels < 1 || channels > 4) {
            throw new DecodeException("不支援的通道數: " + channels);
        }
        long expected = (long) width * height * channels;
        if (buffer.length != expected) {
            throw new DecodeException(String.format("像素緩衝區長度 %d 與 %dx%dx%d 不符 (應為 %d)",
                    buffer.length, width, height, channels, expected));
        }
    }

    public Optional<Path> origin() {
        return Optional.ofNullable(path);
    }

    /**
     * 是否帶有 alpha 通道 (2 或 4 通道)。alpha 永遠不參與比對計算。
     */
    public boolean hasAlpha() {
        return channels == 2 || channels == 4;
    }

    /**
     * 扣除 alpha 後的顏色通道數 (1 或 3)。
     */
    public int colorChannels() {
        return channels >= 3 ? 3 : 1;
    }

    @Override
    public String toString() {
        return "ImageResource[" + width + "x" + height + "x" + channels
                + (path != null ? ", path=" + path : "") + "]";
    }
}
