package work.pollochang.match.image.core;

/**
 * 正規化後可直接做相關運算的整數樣本，每個顏色通道一個平面 (row-major)。
 *
 * @param width  寬度
 * @param height 高度
 * @param layout 樣本排列方式
 * @param planes {@code planes[c][y * width + x]}
 */
public record SampleImage(int width, int height, SampleLayout layout, int[][] planes) {

    public int sample(int plane, int x, int y) {
        return planes[plane][y * width + x];
    }
}
